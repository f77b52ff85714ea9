package com.factmarrow.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * ChatClients of the supported LLM providers and the shared executors.
 * <p>
 * - anthropicChatClient: default provider, used by agents whose model is {@code anthropic/...}
 * - openAiChatClient: used by agents whose model is {@code openai/...}
 */
@Configuration
public class AiConfig {

    @Bean("anthropicChatClient")
    public ChatClient anthropicChatClient(AnthropicChatModel anthropicChatModel) {
        return ChatClient.builder(anthropicChatModel).build();
    }

    @Bean("openAiChatClient")
    public ChatClient openAiChatClient(OpenAiChatModel openAiChatModel) {
        return ChatClient.builder(openAiChatModel).build();
    }

    /**
     * Executor running agent model calls.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService agentExecutor() {
        return Executors.newCachedThreadPool();
    }

    /**
     * Executor running submitted analyses in the background.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService analysisExecutor(FactMarrowProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.workflow().workerThreads()));
    }

    /**
     * Shared ObjectMapper for JSON serialization.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
