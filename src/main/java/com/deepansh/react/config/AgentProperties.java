package com.deepansh.react.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Strongly-typed configuration for the ReAct loop.
 * Bound from application.yml under the "agent" prefix.
 */
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    /** Upper bound accepted for a request's maxSteps */
    private int maxStepsLimit = 10;

    /** Observation recorded on the step that carries the finish action */
    private String completionMarker = "Task complete";

    private Step step = new Step();
    private Parser parser = new Parser();
    private Fallback fallback = new Fallback();
    private Executor executor = new Executor();
    private Stream stream = new Stream();

    @Data
    public static class Step {
        private double temperature = 0.7;
        private int maxTokens = 800;
    }

    /**
     * Values substituted when the model's output is missing a labelled section.
     * The loop relies only on these being non-null, not on their content.
     */
    @Data
    public static class Parser {
        private String defaultThought = "Continue analyzing the problem";
        private String defaultAction = "search";
        private String defaultActionInput = "";
    }

    @Data
    public static class Fallback {
        private double temperature = 0.3;
        private int maxTokens = 500;
    }

    @Data
    public static class Executor {
        private int corePoolSize = 2;
        private int maxPoolSize = 8;
        private int queueCapacity = 50;
    }

    @Data
    public static class Stream {
        private long timeoutMs = 300_000;
    }
}
