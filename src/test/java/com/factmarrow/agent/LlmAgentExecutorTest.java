package com.factmarrow.agent;

import com.factmarrow.exception.ExecutionFailedException;
import com.factmarrow.model.AgentDefinition;
import com.factmarrow.service.ResilientLlmCaller;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmAgentExecutorTest {

    private static final AgentDefinition DEFINITION = new AgentDefinition(
            "verification_specialist", "anthropic/claude-sonnet-4-0", "Verify claims.", List.of());

    @Mock
    private ChatClient chatClient;

    @Mock
    private ResilientLlmCaller llmCaller;

    private ExecutorService taskExecutor;

    @BeforeEach
    void setUp() {
        taskExecutor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        taskExecutor.shutdownNow();
    }

    private LlmAgentExecutor executor(Duration timeout) {
        return new LlmAgentExecutor(DEFINITION, chatClient, ModelId.parse(DEFINITION.model()), List.of(),
                llmCaller, new ObjectMapper(), taskExecutor, timeout);
    }

    @Test
    void shouldReturnModelTextAndRenderContext() {
        // Given
        when(llmCaller.callText(eq(chatClient), any(ChatOptions.class), eq("Verify claims."), anyString(),
                eq("verification_specialist"))).thenReturn("{\"verification_status\": \"supported\"}");

        // When
        String result = executor(Duration.ofSeconds(5))
                .runTask("Verify this claim", Map.of("claim_id", "C-001"))
                .join();

        // Then
        assertThat(result).isEqualTo("{\"verification_status\": \"supported\"}");
        ArgumentCaptor<String> userPrompt = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<ChatOptions> options = ArgumentCaptor.forClass(ChatOptions.class);
        verify(llmCaller).callText(eq(chatClient), options.capture(), eq("Verify claims."), userPrompt.capture(),
                eq("verification_specialist"));
        assertThat(userPrompt.getValue())
                .startsWith("Verify this claim")
                .contains("CONTEXT (JSON):")
                .contains("\"claim_id\":\"C-001\"");
        assertThat(options.getValue().getModel()).isEqualTo("claude-sonnet-4-0");
    }

    @Test
    void shouldSendPromptAloneWithoutContext() {
        // Given
        when(llmCaller.callText(any(), any(), any(), eq("Write the report"), any())).thenReturn("# Report");

        // When
        String result = executor(Duration.ofSeconds(5)).runTask("Write the report", Map.of()).join();

        // Then
        assertThat(result).isEqualTo("# Report");
    }

    @Test
    void shouldWrapModelFailureInExecutionFailed() {
        // Given
        when(llmCaller.callText(any(), any(), any(), anyString(), any()))
                .thenThrow(new IllegalStateException("rate limited"));

        // When
        CompletableFuture<String> future = executor(Duration.ofSeconds(5)).runTask("Verify", Map.of());

        // Then
        assertThatThrownBy(future::join)
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOf(ExecutionFailedException.class)
                .hasMessage("Agent 'verification_specialist' execution failed: rate limited");
    }

    @Test
    void shouldFailWhenDeadlineExpires() {
        // Given
        when(llmCaller.callText(any(), any(), any(), anyString(), any())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return "too late";
        });

        // When
        CompletableFuture<String> future = executor(Duration.ofMillis(100)).runTask("Verify", Map.of());

        // Then
        assertThatThrownBy(future::join)
                .cause()
                .isInstanceOf(ExecutionFailedException.class)
                .hasMessageContaining("timed out");
    }
}
