package com.factmarrow.agent;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs tasks for one configured agent.
 */
@FunctionalInterface
public interface AgentExecutor {

    /**
     * Runs one task.
     *
     * @param prompt  fully rendered task description
     * @param context auxiliary data for the underlying call; not validated
     * @return future completed with the agent's raw structured text, or completed
     *         exceptionally with {@link com.factmarrow.exception.ExecutionFailedException}
     */
    CompletableFuture<String> runTask(String prompt, Map<String, Object> context);
}
