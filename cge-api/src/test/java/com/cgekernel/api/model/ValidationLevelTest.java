package com.cgekernel.api.model;

import com.cgekernel.api.exceptions.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidationLevelTest {

    @Test
    @DisplayName("Should parse validation levels")
    void shouldParseLevels() {
        assertThat(ValidationLevel.parse("basic")).isEqualTo(ValidationLevel.BASIC);
        assertThat(ValidationLevel.parse("FULL")).isEqualTo(ValidationLevel.FULL);
        assertThat(ValidationLevel.parse(null)).isEqualTo(ValidationLevel.BASIC);
    }

    @Test
    @DisplayName("Should reject unknown validation levels")
    void shouldRejectUnknownLevel() {
        assertThatThrownBy(() -> ValidationLevel.parse("paranoid"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("paranoid");
    }

    @Test
    @DisplayName("Should look up categories by key")
    void shouldParseCategories() {
        assertThat(ValidationCategory.parse("mcp")).isEqualTo(ValidationCategory.MCP);
        assertThat(ValidationCategory.SCALING.key()).isEqualTo("scaling");
        assertThatThrownBy(() -> ValidationCategory.parse("style"))
                .isInstanceOf(ConfigurationException.class);
    }
}
