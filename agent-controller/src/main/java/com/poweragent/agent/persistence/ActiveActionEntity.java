package com.poweragent.agent.persistence;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Row of the persisted active-action table. The action itself is stored as JSON.
 */
@Data
@NoArgsConstructor
@Table("active_action")
public class ActiveActionEntity {

    @Id
    private Long id;

    private String actionId;
    private String targetComponent;
    private String origin;
    private String status;
    private String actionJson;
    private LocalDateTime issuedAt;
}
