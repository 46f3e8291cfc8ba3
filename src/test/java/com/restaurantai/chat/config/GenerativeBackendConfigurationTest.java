package com.restaurantai.chat.config;

import com.restaurantai.chat.model.BackendKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GenerativeBackendConfigurationTest {

    @Test
    void openAiKeyTakesPriority() {
        assertThat(GenerativeBackendConfiguration.selectKind("sk-abc", "gsk-def")).isEqualTo(BackendKind.OPENAI);
    }

    @Test
    void groqIsUsedWhenOnlyItsKeyIsSet() {
        assertThat(GenerativeBackendConfiguration.selectKind("  ", "gsk-def")).isEqualTo(BackendKind.GROQ);
    }

    @Test
    void noKeysMeansRuleEngineOnly() {
        assertThat(GenerativeBackendConfiguration.selectKind(null, "")).isEqualTo(BackendKind.NONE);
    }

    @Test
    void keysAreMaskedToPrefixAndSuffix() {
        assertThat(GenerativeBackendConfiguration.mask("sk-proj-1234567890abcdef")).isEqualTo("sk-proj-...cdef");
        assertThat(GenerativeBackendConfiguration.mask("short")).isEqualTo("****");
    }
}
