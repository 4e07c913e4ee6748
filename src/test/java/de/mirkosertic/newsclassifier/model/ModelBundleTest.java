package de.mirkosertic.newsclassifier.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelBundleTest {

    private static ModelBundle sampleBundle() {
        return ModelBundle.of(
                List.of("report", "fake", "breaking"),
                new double[]{1.0, 2.0, 1.5},
                new double[]{0.5, -1.2, 0.3},
                0.1);
    }

    @Test
    @DisplayName("Should expose vocabulary positions as feature indices")
    void shouldExposeFeatureIndices() {
        final ModelBundle bundle = sampleBundle();

        assertThat(bundle.size()).isEqualTo(3);
        assertThat(bundle.vocabulary()).containsExactly("report", "fake", "breaking");
        assertThat(bundle.indexOf("fake")).hasValue(1);
        assertThat(bundle.indexOf("break")).isEmpty();
        assertThat(bundle.term(2)).isEqualTo("breaking");
        assertThat(bundle.idf(1)).isEqualTo(2.0);
        assertThat(bundle.coefficient(0)).isEqualTo(0.5);
        assertThat(bundle.intercept()).isEqualTo(0.1);
    }

    @Test
    @DisplayName("Should copy input arrays and hand out copies")
    void shouldBeImmutable() {
        final double[] idf = {1.0, 2.0};
        final double[] coefficients = {0.5, -0.5};
        final ModelBundle bundle = ModelBundle.of(List.of("a", "b"), idf, coefficients, 0.0);

        idf[0] = 99.0;
        coefficients[0] = 99.0;
        bundle.idfValues()[1] = 42.0;
        bundle.coefficients()[1] = 42.0;

        assertThat(bundle.idfValues()).containsExactly(1.0, 2.0);
        assertThat(bundle.coefficients()).containsExactly(0.5, -0.5);
        assertThatThrownBy(() -> bundle.vocabulary().add("c"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should reject an empty vocabulary")
    void shouldRejectEmptyVocabulary() {
        assertThatThrownBy(() -> ModelBundle.of(List.of(), new double[0], new double[0], 0.0))
                .isInstanceOf(InvalidModelBundleException.class)
                .hasMessageContaining("empty");
    }

    @Test
    @DisplayName("Should reject IDF values that do not match the vocabulary")
    void shouldRejectIdfLengthMismatch() {
        assertThatThrownBy(() -> ModelBundle.of(List.of("a", "b"), new double[]{1.0}, new double[]{0.1, 0.2}, 0.0))
                .isInstanceOf(InvalidModelBundleException.class)
                .hasMessageContaining("IDF length 1");
    }

    @Test
    @DisplayName("Should reject coefficients that do not match the vocabulary")
    void shouldRejectCoefficientLengthMismatch() {
        assertThatThrownBy(() -> ModelBundle.of(List.of("a", "b"), new double[]{1.0, 1.0}, new double[]{0.1, 0.2, 0.3}, 0.0))
                .isInstanceOf(InvalidModelBundleException.class)
                .hasMessageContaining("Coefficient length 3");
    }

    @Test
    @DisplayName("Should reject missing components")
    void shouldRejectMissingComponents() {
        assertThatThrownBy(() -> ModelBundle.of(null, new double[]{1.0}, new double[]{1.0}, 0.0))
                .isInstanceOf(InvalidModelBundleException.class);
        assertThatThrownBy(() -> ModelBundle.of(List.of("a"), null, new double[]{1.0}, 0.0))
                .isInstanceOf(InvalidModelBundleException.class);
        assertThatThrownBy(() -> ModelBundle.of(List.of("a"), new double[]{1.0}, null, 0.0))
                .isInstanceOf(InvalidModelBundleException.class);
    }

    @Test
    @DisplayName("Should reject duplicate and empty terms")
    void shouldRejectBadTerms() {
        assertThatThrownBy(() -> ModelBundle.of(List.of("a", "b", "a"), new double[3], new double[3], 0.0))
                .isInstanceOf(InvalidModelBundleException.class)
                .hasMessageContaining("'a'");
        assertThatThrownBy(() -> ModelBundle.of(Arrays.asList("a", ""), new double[2], new double[2], 0.0))
                .isInstanceOf(InvalidModelBundleException.class);
    }

    @Test
    @DisplayName("Should reject non-finite weights")
    void shouldRejectNonFiniteWeights() {
        assertThatThrownBy(() -> ModelBundle.of(List.of("a"), new double[]{Double.NaN}, new double[]{1.0}, 0.0))
                .isInstanceOf(InvalidModelBundleException.class);
        assertThatThrownBy(() -> ModelBundle.of(List.of("a"), new double[]{1.0}, new double[]{Double.POSITIVE_INFINITY}, 0.0))
                .isInstanceOf(InvalidModelBundleException.class);
        assertThatThrownBy(() -> ModelBundle.of(List.of("a"), new double[]{1.0}, new double[]{1.0}, Double.NaN))
                .isInstanceOf(InvalidModelBundleException.class);
    }
}
