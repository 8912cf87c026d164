package com.poweragent.agent;

import com.poweragent.agent.config.AgentProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AgentProperties.class)
public class PowerAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(PowerAgentApplication.class, args);
    }
}
