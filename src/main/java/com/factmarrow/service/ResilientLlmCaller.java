package com.factmarrow.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;

import java.time.Duration;

/**
 * LLM calls with automatic retry.
 * <p>
 * Retries up to {@code maxRetries} times with a linearly growing backoff
 * ({@code attempt * backoff}) when the call fails or the response has no text.
 */
public class ResilientLlmCaller {

    private static final Logger log = LoggerFactory.getLogger(ResilientLlmCaller.class);

    private final int maxRetries;
    private final Duration backoff;

    public ResilientLlmCaller(int maxRetries, Duration backoff) {
        this.maxRetries = Math.max(0, maxRetries);
        this.backoff = backoff;
    }

    /**
     * Calls the model and returns the text of the first generation.
     *
     * @param chatClient   the LLM client to use
     * @param options      per-call options (model, tool callbacks)
     * @param systemPrompt the system prompt
     * @param userPrompt   the user prompt
     * @param agentName    agent name (for logging)
     * @return the response text, never blank
     * @throws RuntimeException if all attempts fail
     */
    public String callText(ChatClient chatClient, ChatOptions options, String systemPrompt,
                           String userPrompt, String agentName) {
        Exception lastError = null;
        for (int attempt = 1; attempt <= maxRetries + 1; attempt++) {
            try {
                ChatClient.ChatClientRequestSpec request = chatClient.prompt()
                        .user(userPrompt)
                        .options(options);
                if (systemPrompt != null && !systemPrompt.isBlank()) {
                    request = request.system(systemPrompt);
                }
                ChatResponse chatResponse = request.call().chatResponse();

                String content = (chatResponse != null && chatResponse.getResult() != null)
                        ? chatResponse.getResult().getOutput().getText()
                        : null;
                if (content == null || content.isBlank()) {
                    throw new IllegalStateException("Empty or null content in LLM response");
                }
                return content;
            } catch (Exception e) {
                lastError = e;
                if (attempt <= maxRetries) {
                    long delay = attempt * backoff.toMillis();
                    log.warn("{}: attempt {}/{} failed ({}), retrying in {}ms...",
                            agentName, attempt, maxRetries + 1, rootCauseMessage(e), delay);
                    try {
                        Thread.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        }
        throw new IllegalStateException("Error in " + agentName + " after " + (maxRetries + 1)
                + " attempts: " + lastError.getMessage(), lastError);
    }

    private static String rootCauseMessage(Exception e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage();
        return msg != null && msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
