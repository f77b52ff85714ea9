package com.factmarrow.agent;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelIdTest {

    @Test
    void shouldSplitProviderAndModel() {
        assertThat(ModelId.parse("openai/gpt-4o")).isEqualTo(new ModelId("openai", "gpt-4o"));
        assertThat(ModelId.parse("Anthropic/claude-sonnet-4-0"))
                .isEqualTo(new ModelId("anthropic", "claude-sonnet-4-0"));
    }

    @Test
    void shouldDefaultToAnthropicWithoutPrefix() {
        assertThat(ModelId.parse("claude-sonnet-4-0").provider()).isEqualTo(ModelId.ANTHROPIC);
    }

    @Test
    void shouldRejectMalformedIds() {
        assertThatThrownBy(() -> ModelId.parse("openai/")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ModelId.parse("/gpt-4o")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ModelId.parse(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
