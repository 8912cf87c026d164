package com.poweragent.agent.persistence;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Outcome or feedback entry of the learning ring buffer; {@code kind} tells which.
 */
@Data
@NoArgsConstructor
@Table("learning_record")
public class LearningRecordEntity {

    public static final String KIND_OUTCOME  = "OUTCOME";
    public static final String KIND_FEEDBACK = "FEEDBACK";

    @Id
    private Long id;

    private String kind;
    private String payload;
    private LocalDateTime recordedAt;
}
