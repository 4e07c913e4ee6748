package de.mirkosertic.newsclassifier.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ApplicationConfig Tests")
class ApplicationConfigTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should provide built-in defaults")
    void shouldProvideDefaults() {
        final ApplicationConfig config = ApplicationConfig.defaults();

        assertThat(config.getModelPath()).isNull();
        assertThat(config.getUncertaintyThreshold()).isEqualTo(0.6);
        assertThat(config.getTopFeatures()).isEqualTo(20);
        assertThat(config.getStemCacheSize()).isEqualTo(50_000L);
        assertThat(config.isTraceStemming()).isFalse();
        assertThat(config.isDeployedMode()).isFalse();
    }

    @Test
    @DisplayName("Should keep defaults when the classpath config has no model path")
    void shouldLoadClasspathDefaults() {
        final ApplicationConfig config = new ApplicationConfig();
        config.loadFromClasspath("application.yaml");

        assertThat(config.getUncertaintyThreshold()).isEqualTo(0.6);
        assertThat(config.getTopFeatures()).isEqualTo(20);
        assertThat(config.getStemCacheSize()).isEqualTo(50_000L);
    }

    @Test
    @DisplayName("Should apply all classifier keys from YAML")
    void shouldApplyYamlConfig() {
        final ApplicationConfig config = new ApplicationConfig();
        config.applyYamlConfig(Map.of("classifier", Map.of(
                "model", Map.of("path", " /opt/models/model_params.json "),
                "uncertainty-threshold", 0.75,
                "explain", Map.of("top-features", 5),
                "stemming", Map.of("cache-size", 0, "trace", true))));

        assertThat(config.getModelPath()).isEqualTo("/opt/models/model_params.json");
        assertThat(config.getUncertaintyThreshold()).isEqualTo(0.75);
        assertThat(config.getTopFeatures()).isEqualTo(5);
        assertThat(config.getStemCacheSize()).isZero();
        assertThat(config.isTraceStemming()).isTrue();
    }

    @Test
    @DisplayName("Should resolve placeholders with defaults")
    void shouldResolvePlaceholderDefaults() {
        final ApplicationConfig config = new ApplicationConfig();
        config.applyYamlConfig(Map.of("classifier", Map.of(
                "model", Map.of("path", "${NEWSCLASSIFIER_TEST_UNSET_VARIABLE:/srv/model.json}"))));

        assertThat(config.getModelPath()).isEqualTo("/srv/model.json");
    }

    @Test
    @DisplayName("Should treat an empty resolved model path as unset")
    void shouldTreatEmptyPathAsUnset() {
        final ApplicationConfig config = new ApplicationConfig();
        config.applyYamlConfig(Map.of("classifier", Map.of(
                "model", Map.of("path", "${NEWSCLASSIFIER_TEST_UNSET_VARIABLE:}"))));

        assertThat(config.getModelPath()).isNull();
    }

    @Test
    @DisplayName("Should ignore YAML without classifier section")
    void shouldIgnoreUnrelatedYaml() {
        final ApplicationConfig config = new ApplicationConfig();
        config.applyYamlConfig(Map.of("other", Map.of("key", "value")));

        assertThat(config.getUncertaintyThreshold()).isEqualTo(0.6);
    }

    @Test
    @DisplayName("Should read a user config file")
    void shouldLoadFromFile() throws IOException {
        final Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, """
                classifier:
                  model:
                    path: /home/user/model.json
                  explain:
                    top-features: 3
                """);

        final ApplicationConfig config = new ApplicationConfig();
        config.loadFromFile(file);

        assertThat(config.getModelPath()).isEqualTo("/home/user/model.json");
        assertThat(config.getTopFeatures()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should skip a missing user config file")
    void shouldSkipMissingFile() {
        final ApplicationConfig config = new ApplicationConfig();
        config.loadFromFile(tempDir.resolve("missing.yaml"));

        assertThat(config.getModelPath()).isNull();
    }

    @Test
    @DisplayName("Environment variable should win over system property")
    void shouldPreferEnvironmentOverProperty() {
        final ApplicationConfig config = new ApplicationConfig();
        config.setModelPath("/from/yaml.json");

        config.applyOverrides(null, "/from/property.json");
        assertThat(config.getModelPath()).isEqualTo("/from/property.json");

        config.applyOverrides("/from/env.json", "/from/property.json");
        assertThat(config.getModelPath()).isEqualTo("/from/env.json");

        config.applyOverrides("  ", null);
        assertThat(config.getModelPath()).isEqualTo("/from/env.json");
    }

    @Test
    @DisplayName("Should allow programmatic configuration")
    void shouldApplySetters() {
        final ApplicationConfig config = ApplicationConfig.defaults();
        config.setUncertaintyThreshold(0.9);
        config.setTopFeatures(7);
        config.setStemCacheSize(0);
        config.setTraceStemming(true);

        assertThat(config.getUncertaintyThreshold()).isEqualTo(0.9);
        assertThat(config.getTopFeatures()).isEqualTo(7);
        assertThat(config.getStemCacheSize()).isZero();
        assertThat(config.isTraceStemming()).isTrue();
        config.validate();
    }

    @Test
    @DisplayName("Should reject out-of-range settings")
    void shouldValidateRanges() {
        final ApplicationConfig lowThreshold = new ApplicationConfig();
        lowThreshold.applyYamlConfig(Map.of("classifier", Map.of("uncertainty-threshold", 0.4)));
        assertThatThrownBy(lowThreshold::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("uncertainty-threshold");

        final ApplicationConfig negativeTop = new ApplicationConfig();
        negativeTop.applyYamlConfig(Map.of("classifier", Map.of("explain", Map.of("top-features", -1))));
        assertThatThrownBy(negativeTop::validate)
                .isInstanceOf(IllegalStateException.class);

        final ApplicationConfig negativeCache = new ApplicationConfig();
        negativeCache.applyYamlConfig(Map.of("classifier", Map.of("stemming", Map.of("cache-size", -5))));
        assertThatThrownBy(negativeCache::validate)
                .isInstanceOf(IllegalStateException.class);

        ApplicationConfig.defaults().validate();
    }
}
