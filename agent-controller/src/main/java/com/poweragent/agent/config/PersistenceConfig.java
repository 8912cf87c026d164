package com.poweragent.agent.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.poweragent.agent.persistence.ActiveActionRepository;
import com.poweragent.agent.persistence.AgentStateStore;
import com.poweragent.agent.persistence.LearningRecordRepository;
import com.poweragent.agent.persistence.ModelStateRepository;
import com.poweragent.agent.persistence.R2dbcAgentStateStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Schema is created by {@code spring.sql.init} from {@code schema.sql}.
 */
@Configuration
public class PersistenceConfig {

    @Bean
    public AgentStateStore agentStateStore(ActiveActionRepository activeActions,
                                           LearningRecordRepository learningRecords,
                                           ModelStateRepository models,
                                           ObjectMapper objectMapper,
                                           AgentProperties properties) {
        return new R2dbcAgentStateStore(activeActions, learningRecords, models, objectMapper,
            properties.getLearning().getBufferSize(), properties.getLearning().getModelHistory());
    }
}
