package de.mirkosertic.newsclassifier.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelBundleLoaderTest {

    @TempDir
    Path tempDir;

    private ModelBundleLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ModelBundleLoader();
    }

    private static InputStream json(final String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should load the bundled test model from the classpath")
    void shouldLoadClasspathResource() throws IOException {
        final ModelBundle bundle = loader.loadResource("model/test_model.json");

        assertThat(bundle.vocabulary()).containsExactly("report", "fake", "breaking");
        assertThat(bundle.idfValues()).containsExactly(1.0, 2.0, 1.5);
        assertThat(bundle.coefficients()).containsExactly(0.5, -1.2, 0.3);
        assertThat(bundle.intercept()).isEqualTo(0.1);
    }

    @Test
    @DisplayName("Should load a model file and ignore unknown properties")
    void shouldLoadFromFile() throws IOException {
        final Path file = tempDir.resolve("model_params.json");
        Files.writeString(file, """
                {
                  "vocabulary": ["news", "hoax"],
                  "idf_values": [1.25, 3.5],
                  "coefficients": [-0.75, 2.0],
                  "intercept": -0.2,
                  "max_features": 5000
                }
                """);

        final ModelBundle bundle = loader.load(file);

        assertThat(bundle.size()).isEqualTo(2);
        assertThat(bundle.indexOf("hoax")).hasValue(1);
        assertThat(bundle.intercept()).isEqualTo(-0.2);
    }

    @Test
    @DisplayName("Should report a missing file as FileNotFoundException")
    void shouldFailOnMissingFile() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("missing.json")))
                .isInstanceOf(FileNotFoundException.class);
        assertThatThrownBy(() -> loader.load(tempDir))
                .isInstanceOf(FileNotFoundException.class);
        assertThatThrownBy(() -> loader.loadResource("model/missing.json"))
                .isInstanceOf(FileNotFoundException.class);
    }

    @Test
    @DisplayName("Should report malformed JSON as IOException")
    void shouldFailOnMalformedJson() {
        assertThatThrownBy(() -> loader.load(json("{\"vocabulary\": [\"a\"")))
                .isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Should reject a document without intercept")
    void shouldRejectMissingIntercept() {
        assertThatThrownBy(() -> loader.load(json(
                "{\"vocabulary\": [\"a\"], \"idf_values\": [1.0], \"coefficients\": [0.5]}")))
                .isInstanceOf(InvalidModelBundleException.class)
                .hasMessageContaining("Intercept");
    }

    @Test
    @DisplayName("Should reject a document without vocabulary")
    void shouldRejectMissingVocabulary() {
        assertThatThrownBy(() -> loader.load(json(
                "{\"idf_values\": [1.0], \"coefficients\": [0.5], \"intercept\": 0.0}")))
                .isInstanceOf(InvalidModelBundleException.class)
                .hasMessageContaining("Vocabulary");
    }

    @Test
    @DisplayName("Should reject a JSON null document")
    void shouldRejectNullDocument() {
        assertThatThrownBy(() -> loader.load(json("null")))
                .isInstanceOf(InvalidModelBundleException.class);
    }

    @Test
    @DisplayName("Should reject arrays of different length")
    void shouldRejectLengthMismatch() {
        assertThatThrownBy(() -> loader.load(json(
                "{\"vocabulary\": [\"a\", \"b\"], \"idf_values\": [1.0], \"coefficients\": [0.5, 0.1], \"intercept\": 0.0}")))
                .isInstanceOf(InvalidModelBundleException.class);
    }
}
