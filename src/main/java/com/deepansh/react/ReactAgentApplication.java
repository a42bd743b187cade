package com.deepansh.react;

import com.deepansh.react.config.AgentProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AgentProperties.class)
public class ReactAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReactAgentApplication.class, args);
    }
}
