package com.factmarrow.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Configuration properties for the analysis service.
 */
@ConfigurationProperties(prefix = "factmarrow")
public record FactMarrowProperties(
        @DefaultValue Agents agents,
        @DefaultValue Mcp mcp,
        @DefaultValue Workflow workflow,
        @DefaultValue Llm llm,
        @DefaultValue Storage storage
) {

    /**
     * @param config location of the agent table YAML
     */
    public record Agents(@DefaultValue("classpath:agents/factmarrow_agents.yaml") String config) {}

    /**
     * @param config location of the tool-server table YAML
     */
    public record Mcp(@DefaultValue("classpath:config/mcp_servers.yaml") String config) {}

    /**
     * @param taskTimeout             deadline of a single agent task
     * @param verificationConcurrency claims verified concurrently (1 = sequential)
     * @param retention               how long a finished analysis stays queryable in memory
     * @param maxRetained             maximum finished analyses kept in memory
     * @param workerThreads           threads running submitted analyses
     */
    public record Workflow(
            @DefaultValue("2m") Duration taskTimeout,
            @DefaultValue("1") int verificationConcurrency,
            @DefaultValue("1h") Duration retention,
            @DefaultValue("500") long maxRetained,
            @DefaultValue("4") int workerThreads
    ) {}

    /**
     * @param maxRetries   retries after a failed model call
     * @param retryBackoff base delay between retries (multiplied by the attempt number)
     */
    public record Llm(
            @DefaultValue("2") int maxRetries,
            @DefaultValue("2s") Duration retryBackoff
    ) {}

    /**
     * @param documentsDir directory where uploaded documents are stored
     */
    public record Storage(@DefaultValue("data/documents") String documentsDir) {}
}
