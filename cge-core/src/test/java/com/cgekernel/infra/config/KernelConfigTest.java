package com.cgekernel.infra.config;

import com.cgekernel.api.exceptions.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KernelConfigTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Builder should start from defaults")
    void builderShouldUseDefaults() {
        KernelConfig config = KernelConfig.builder().build();

        assertThat(config.getTolerance()).isEqualTo(1e-6);
        assertThat(config.getDatasetId()).isEqualTo("cge");
        assertThat(config.getDefaultBackend()).isEqualTo("evaluate");
        assertThat(config.getNewtonMaxIterations()).isEqualTo(50);
        assertThat(config.getScalingLargeThreshold()).isEqualTo(1e6);
        assertThat(config.getScalingSmallThreshold()).isEqualTo(1e-8);
        assertThat(config.getTopResidualCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should load properties from the classpath")
    void shouldLoadFromClasspath() {
        KernelConfig config = KernelConfig.loadFromProperties("kernel-test.properties");

        assertThat(config.getTolerance()).isEqualTo(1e-8);
        assertThat(config.getDatasetId()).isEqualTo("fixture");
        assertThat(config.getDefaultBackend()).isEqualTo("newton");
        assertThat(config.getNewtonMaxIterations()).isEqualTo(25);
        assertThat(config.getTopResidualCount()).isEqualTo(3);
        assertThat(config.getNewtonTolerance()).isEqualTo(KernelConfig.DEFAULT_NEWTON_TOLERANCE);
    }

    @Test
    @DisplayName("Should load properties from a file path")
    void shouldLoadFromFile() throws Exception {
        Path file = tempDir.resolve("kernel.properties");
        Files.writeString(file, "kernel.scaling.large=1e9\nkernel.scaling.small=1e-12\n");

        KernelConfig config = KernelConfig.loadFromProperties(file.toString());

        assertThat(config.getScalingLargeThreshold()).isEqualTo(1e9);
        assertThat(config.getScalingSmallThreshold()).isEqualTo(1e-12);
    }

    @Test
    @DisplayName("Missing properties file should fall back to defaults")
    void missingFileShouldUseDefaults() {
        KernelConfig config = KernelConfig.loadFromProperties(tempDir.resolve("absent.properties").toString());

        assertThat(config.getDatasetId()).isEqualTo(KernelConfig.DEFAULT_DATASET_ID);
    }

    @Test
    @DisplayName("Environment should override properties")
    void environmentShouldOverrideProperties() {
        Properties props = new Properties();
        props.setProperty("kernel.dataset.id", "from-file");
        props.setProperty("kernel.tolerance", "1e-4");

        KernelConfig config = KernelConfig.builder()
                .properties(props)
                .environment(Map.of("CGE_DATASET_ID", "from-env", "CGE_TOP_RESIDUALS", "10"))
                .build();

        assertThat(config.getDatasetId()).isEqualTo("from-env");
        assertThat(config.getTolerance()).isEqualTo(1e-4);
        assertThat(config.getTopResidualCount()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should reject malformed numbers")
    void shouldRejectMalformedNumbers() {
        assertThatThrownBy(() -> KernelConfig.builder().environment(Map.of("CGE_TOLERANCE", "tiny")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("CGE_TOLERANCE");
    }

    @Test
    @DisplayName("Should reject invalid values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> KernelConfig.builder().tolerance(-1.0).build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("tolerance");
        assertThatThrownBy(() -> KernelConfig.builder().scalingThresholds(1.0, 0.5).build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("scaling thresholds");
        assertThatThrownBy(() -> KernelConfig.builder().newtonMaxIterations(0).build())
                .isInstanceOf(ConfigurationException.class);
    }
}
