package com.factmarrow.agent;

import com.factmarrow.exception.ExecutionFailedException;
import com.factmarrow.model.AgentDefinition;
import com.factmarrow.service.ResilientLlmCaller;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.tool.ToolCallback;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes an agent's tasks with a Spring AI {@link ChatClient}.
 * <p>
 * The agent instruction is the system prompt; the task prompt plus the JSON-rendered
 * context is the user prompt. Every call runs on the task executor under a deadline,
 * and any failure (including an expired deadline) completes the future with
 * {@link ExecutionFailedException}.
 */
public class LlmAgentExecutor implements AgentExecutor {

    private static final Logger log = LoggerFactory.getLogger(LlmAgentExecutor.class);

    private final AgentDefinition definition;
    private final ChatClient chatClient;
    private final ModelId modelId;
    private final List<ToolCallback> toolCallbacks;
    private final ResilientLlmCaller llmCaller;
    private final ObjectMapper objectMapper;
    private final Executor taskExecutor;
    private final Duration timeout;

    public LlmAgentExecutor(AgentDefinition definition,
                            ChatClient chatClient,
                            ModelId modelId,
                            List<ToolCallback> toolCallbacks,
                            ResilientLlmCaller llmCaller,
                            ObjectMapper objectMapper,
                            Executor taskExecutor,
                            Duration timeout) {
        this.definition = definition;
        this.chatClient = chatClient;
        this.modelId = modelId;
        this.toolCallbacks = List.copyOf(toolCallbacks);
        this.llmCaller = llmCaller;
        this.objectMapper = objectMapper;
        this.taskExecutor = taskExecutor;
        this.timeout = timeout;
    }

    @Override
    public CompletableFuture<String> runTask(String prompt, Map<String, Object> context) {
        String agentName = definition.name();
        log.debug("{}: executing task with prompt length {}", agentName, prompt.length());

        String userPrompt;
        try {
            userPrompt = renderUserPrompt(prompt, context);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new ExecutionFailedException(agentName,
                    "Agent '" + agentName + "' context could not be serialized: " + e.getOriginalMessage(), e));
        }

        ToolCallingChatOptions options = ToolCallingChatOptions.builder()
                .model(modelId.model())
                .toolCallbacks(toolCallbacks)
                .build();

        return CompletableFuture
                .supplyAsync(() -> llmCaller.callText(chatClient, options,
                        definition.instruction(), userPrompt, agentName), taskExecutor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, error) -> {
                    if (error == null) {
                        log.debug("{}: task executed successfully, result length {}", agentName, result.length());
                        return result;
                    }
                    throw toExecutionFailed(agentName, unwrap(error));
                });
    }

    public AgentDefinition definition() {
        return definition;
    }

    public List<ToolCallback> toolCallbacks() {
        return toolCallbacks;
    }

    private String renderUserPrompt(String prompt, Map<String, Object> context) throws JsonProcessingException {
        if (context == null || context.isEmpty()) {
            return prompt;
        }
        return prompt + "\n\nCONTEXT (JSON):\n" + objectMapper.writeValueAsString(context);
    }

    private ExecutionFailedException toExecutionFailed(String agentName, Throwable cause) {
        if (cause instanceof ExecutionFailedException failed) {
            return failed;
        }
        if (cause instanceof TimeoutException) {
            return new ExecutionFailedException(agentName,
                    "Agent '" + agentName + "' timed out after " + timeout.toSeconds() + "s", cause);
        }
        return new ExecutionFailedException(agentName,
                "Agent '" + agentName + "' execution failed: " + cause.getMessage(), cause);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
