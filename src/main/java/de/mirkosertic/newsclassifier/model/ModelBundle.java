package de.mirkosertic.newsclassifier.model;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Immutable parameters of the trained classifier: vocabulary, inverse document frequencies,
 * logistic regression coefficients and intercept.
 *
 * <p>The position of a term in the vocabulary is its feature index; IDF values and coefficients
 * are parallel to it. The bundle validates these invariants on construction, copies all
 * inputs and only hands out copies or read-only views, so a single instance can be shared by
 * any number of concurrent classification calls.</p>
 */
public final class ModelBundle {

    private final List<String> vocabulary;
    private final Map<String, Integer> termIndex;
    private final double[] idf;
    private final double[] coefficients;
    private final double intercept;

    private ModelBundle(final List<String> vocabulary,
                        final Map<String, Integer> termIndex,
                        final double[] idf,
                        final double[] coefficients,
                        final double intercept) {
        this.vocabulary = vocabulary;
        this.termIndex = termIndex;
        this.idf = idf;
        this.coefficients = coefficients;
        this.intercept = intercept;
    }

    /**
     * Creates a validated bundle.
     *
     * @throws InvalidModelBundleException if any component is missing, the vocabulary is empty
     *                                     or contains duplicates, the arrays differ in length, or
     *                                     a weight is NaN or infinite
     */
    public static ModelBundle of(final List<String> vocabulary,
                                 final double[] idf,
                                 final double[] coefficients,
                                 final double intercept) {
        if (vocabulary == null) {
            throw new InvalidModelBundleException("Vocabulary is missing");
        }
        if (idf == null) {
            throw new InvalidModelBundleException("IDF values are missing");
        }
        if (coefficients == null) {
            throw new InvalidModelBundleException("Coefficients are missing");
        }
        if (vocabulary.isEmpty()) {
            throw new InvalidModelBundleException("Vocabulary is empty");
        }
        if (idf.length != vocabulary.size()) {
            throw new InvalidModelBundleException(String.format(
                    "IDF length %d does not match vocabulary size %d", idf.length, vocabulary.size()));
        }
        if (coefficients.length != vocabulary.size()) {
            throw new InvalidModelBundleException(String.format(
                    "Coefficient length %d does not match vocabulary size %d", coefficients.length, vocabulary.size()));
        }
        if (!Double.isFinite(intercept)) {
            throw new InvalidModelBundleException("Intercept is not a finite number: " + intercept);
        }

        final Map<String, Integer> index = new HashMap<>(vocabulary.size() * 2);
        for (int i = 0; i < vocabulary.size(); i++) {
            final String term = vocabulary.get(i);
            if (term == null || term.isEmpty()) {
                throw new InvalidModelBundleException("Vocabulary entry " + i + " is empty");
            }
            final Integer previous = index.putIfAbsent(term, i);
            if (previous != null) {
                throw new InvalidModelBundleException(String.format(
                        "Vocabulary term '%s' occurs at positions %d and %d", term, previous, i));
            }
            if (!Double.isFinite(idf[i])) {
                throw new InvalidModelBundleException("IDF value for '" + term + "' is not finite: " + idf[i]);
            }
            if (!Double.isFinite(coefficients[i])) {
                throw new InvalidModelBundleException("Coefficient for '" + term + "' is not finite: " + coefficients[i]);
            }
        }

        return new ModelBundle(
                List.copyOf(vocabulary),
                Map.copyOf(index),
                idf.clone(),
                coefficients.clone(),
                intercept);
    }

    public int size() {
        return vocabulary.size();
    }

    public List<String> vocabulary() {
        return vocabulary;
    }

    public String term(final int index) {
        return vocabulary.get(index);
    }

    /**
     * Returns the feature index of a term, or empty if the term is not in the vocabulary.
     */
    public OptionalInt indexOf(final String term) {
        final Integer index = termIndex.get(term);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    public double idf(final int index) {
        return idf[index];
    }

    public double coefficient(final int index) {
        return coefficients[index];
    }

    public double intercept() {
        return intercept;
    }

    public double[] idfValues() {
        return idf.clone();
    }

    public double[] coefficients() {
        return coefficients.clone();
    }

    @Override
    public String toString() {
        return "ModelBundle[vocabularySize=" + vocabulary.size()
                + ", intercept=" + intercept
                + ", idfRange=" + Arrays.stream(idf).min().orElse(0) + ".." + Arrays.stream(idf).max().orElse(0)
                + "]";
    }
}
