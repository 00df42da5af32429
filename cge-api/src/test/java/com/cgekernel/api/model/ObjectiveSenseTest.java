package com.cgekernel.api.model;

import com.cgekernel.api.exceptions.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ObjectiveSenseTest {

    @ParameterizedTest
    @ValueSource(strings = {"max", "maximize", "MAX", " Maximize "})
    @DisplayName("Should parse maximize aliases")
    void shouldParseMaximize(String value) {
        assertThat(ObjectiveSense.parse(value)).isEqualTo(ObjectiveSense.MAXIMIZE);
    }

    @ParameterizedTest
    @ValueSource(strings = {"min", "minimize", "MIN"})
    @DisplayName("Should parse minimize aliases")
    void shouldParseMinimize(String value) {
        assertThat(ObjectiveSense.parse(value)).isEqualTo(ObjectiveSense.MINIMIZE);
    }

    @Test
    @DisplayName("Missing sense should default to maximize")
    void missingSenseShouldDefaultToMaximize() {
        assertThat(ObjectiveSense.parse(null)).isEqualTo(ObjectiveSense.MAXIMIZE);
        assertThat(ObjectiveSense.DEFAULT).isEqualTo(ObjectiveSense.MAXIMIZE);
    }

    @Test
    @DisplayName("Should reject unknown senses")
    void shouldRejectUnknownSense() {
        assertThatThrownBy(() -> ObjectiveSense.parse("optimize"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Unsupported objective sense: optimize");
    }
}
