package com.conveyor.engine.model;

import com.conveyor.engine.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParameterTest {

    @Test
    void string_missingWithoutDefault_isConfigurationError() {
        Parameter version = Parameter.string("PROJECT_VERSION", null, "version");

        assertThatThrownBy(() -> version.resolve(null))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("PROJECT_VERSION");
        assertThat(version.resolve("1.2.0")).isEqualTo("1.2.0");
    }

    @Test
    void choice_defaultsToFirstAllowedValue() {
        Parameter severity = Parameter.choice("TRIVY_SEVERITY", List.of("HIGH,CRITICAL", "LOW,MEDIUM"), null);

        assertThat(severity.resolve(null)).isEqualTo("HIGH,CRITICAL");
        assertThat(severity.resolve("LOW,MEDIUM")).isEqualTo("LOW,MEDIUM");
    }

    @Test
    void choice_valueOutsideAllowedSet_isConfigurationError() {
        Parameter severity = Parameter.choice("TRIVY_SEVERITY", List.of("HIGH,CRITICAL", "LOW,MEDIUM"), null);

        assertThatThrownBy(() -> severity.resolve("MEDIUM"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("must be one of");
    }

    @Test
    void bool_acceptsOnlyTrueOrFalseLiterals() {
        Parameter failOnLeaks = Parameter.bool("FAIL_ON_LEAKS", true, null);

        assertThat(failOnLeaks.resolve(null)).isEqualTo(Boolean.TRUE);
        assertThat(failOnLeaks.resolve("FALSE")).isEqualTo(Boolean.FALSE);
        assertThatThrownBy(() -> failOnLeaks.resolve("yes"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("true or false");
    }

    @Test
    void choice_withoutAllowedValues_isRejectedAtDeclaration() {
        assertThatThrownBy(() -> Parameter.choice("X", List.of(), null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
