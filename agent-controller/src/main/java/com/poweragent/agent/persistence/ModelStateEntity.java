package com.poweragent.agent.persistence;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@Table("model_state")
public class ModelStateEntity {

    @Id
    private Long id;

    private long version;
    private int trainingSamples;
    private double trainingAccuracy;
    private String parameters;
    private LocalDateTime trainedAt;
}
