package com.factmarrow.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResilientLlmCallerTest {

    @Mock
    private ChatClient chatClient;

    @Mock
    private ChatClient.ChatClientRequestSpec requestSpec;

    @Mock
    private ChatClient.CallResponseSpec callSpec;

    private final ChatOptions options = ChatOptions.builder().model("claude-sonnet-4-0").build();

    @BeforeEach
    void setUp() {
        lenient().when(chatClient.prompt()).thenReturn(requestSpec);
        lenient().when(requestSpec.user(anyString())).thenReturn(requestSpec);
        lenient().when(requestSpec.options(any(ChatOptions.class))).thenReturn(requestSpec);
        lenient().when(requestSpec.system(anyString())).thenReturn(requestSpec);
        lenient().when(requestSpec.call()).thenReturn(callSpec);
    }

    private static ChatResponse response(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    @Test
    void shouldReturnTextOfFirstGeneration() {
        // Given
        when(callSpec.chatResponse()).thenReturn(response("{\"claims\": []}"));

        // When
        String text = new ResilientLlmCaller(2, Duration.ZERO)
                .callText(chatClient, options, "Extract claims.", "Document...", "fact_extractor");

        // Then
        assertThat(text).isEqualTo("{\"claims\": []}");
        verify(requestSpec).system("Extract claims.");
        verify(chatClient, times(1)).prompt();
    }

    @Test
    void shouldSkipBlankSystemPrompt() {
        // Given
        when(callSpec.chatResponse()).thenReturn(response("ok"));

        // When
        new ResilientLlmCaller(0, Duration.ZERO).callText(chatClient, options, "", "task", "root");

        // Then
        verify(requestSpec, never()).system(anyString());
    }

    @Test
    void shouldRetryAfterFailure() {
        // Given
        when(callSpec.chatResponse())
                .thenThrow(new RuntimeException("overloaded"))
                .thenReturn(response("recovered"));

        // When
        String text = new ResilientLlmCaller(2, Duration.ZERO)
                .callText(chatClient, options, "Verify.", "claim", "verification_specialist");

        // Then
        assertThat(text).isEqualTo("recovered");
        verify(chatClient, times(2)).prompt();
    }

    @Test
    void shouldFailAfterExhaustingRetriesOnBlankContent() {
        // Given
        when(callSpec.chatResponse()).thenReturn(response("   "));
        ResilientLlmCaller caller = new ResilientLlmCaller(1, Duration.ZERO);

        // When / Then
        assertThatThrownBy(() -> caller.callText(chatClient, options, "Review.", "report", "quality_reviewer"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("quality_reviewer after 2 attempts")
                .hasMessageContaining("Empty or null content");
        verify(chatClient, times(2)).prompt();
    }
}
