package com.phillippitts.mathwords.service.style;

import com.phillippitts.mathwords.exception.UnknownStyleException;
import com.phillippitts.mathwords.service.registry.Operator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpeechStyleRegistryTest {

    private final SpeechStyleRegistry registry = new SpeechStyleRegistry();

    @Test
    void shouldListStylesInRegistrationOrder() {
        assertThat(registry.names()).containsExactly(
                SpeechStyleNames.CLEAR_SPEAK, SpeechStyleNames.SIMPLE_SPEAK, SpeechStyleNames.LITERAL_SPEAK);
    }

    @Test
    void namesShouldBeStableAcrossCalls() {
        assertThat(registry.names()).isEqualTo(registry.names());
        assertThat(new SpeechStyleRegistry().names()).isEqualTo(registry.names());
    }

    @Test
    void namesShouldBeUnmodifiable() {
        assertThatThrownBy(() -> registry.names().add("Other"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldMatchNamesExactly() {
        assertThat(registry.find("ClearSpeak")).isPresent();
        assertThat(registry.find("clearspeak")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
    }

    @Test
    void requireShouldRejectUnknownStyle() {
        assertThatThrownBy(() -> registry.require("NoSuchStyle"))
                .isInstanceOf(UnknownStyleException.class)
                .hasMessageContaining("NoSuchStyle");
    }

    @Test
    void clearSpeakShouldUseDisplayWordingOnlyInDisplayMode() {
        SpeechStyle clear = registry.require(SpeechStyleNames.CLEAR_SPEAK);

        assertThat(clear.operatorWord(Operator.EQUALS, false)).isEqualTo("equals");
        assertThat(clear.operatorWord(Operator.EQUALS, true)).isEqualTo("is equal to");
    }

    @Test
    void stylesShouldOverrideOperatorWords() {
        assertThat(registry.require(SpeechStyleNames.SIMPLE_SPEAK).operatorWord(Operator.DOT, false))
                .isEqualTo("times");
        assertThat(registry.require(SpeechStyleNames.LITERAL_SPEAK).operatorWord(Operator.LESS, false))
                .isEqualTo("less than");
        assertThat(registry.require(SpeechStyleNames.CLEAR_SPEAK).operatorWord(Operator.LESS, false))
                .isEqualTo("is less than");
    }

    @Test
    void onlyLiteralSpeakShouldSpeakDelimitersAlways() {
        assertThat(registry.require(SpeechStyleNames.LITERAL_SPEAK).explicitDelimiters()).isTrue();
        assertThat(registry.require(SpeechStyleNames.CLEAR_SPEAK).explicitDelimiters()).isFalse();
        assertThat(registry.require(SpeechStyleNames.SIMPLE_SPEAK).explicitDelimiters()).isFalse();
    }
}
