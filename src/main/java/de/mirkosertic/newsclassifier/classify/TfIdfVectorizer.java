package de.mirkosertic.newsclassifier.classify;

import de.mirkosertic.newsclassifier.analysis.TextNormalizer;
import de.mirkosertic.newsclassifier.model.ModelBundle;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Converts text into the dense, L2-normalized TF-IDF feature vector of a {@link ModelBundle}.
 *
 * <p>Term frequency is the raw count of a token in the text, not the count divided by the
 * text length. Each vocabulary term present in the text gets {@code count * idf}; tokens outside
 * the vocabulary are ignored. The vector is then divided by its Euclidean norm unless it is
 * all zero.</p>
 */
public class TfIdfVectorizer {

    private final ModelBundle bundle;
    private final TextNormalizer normalizer;

    public TfIdfVectorizer(final ModelBundle bundle, final TextNormalizer normalizer) {
        this.bundle = bundle;
        this.normalizer = normalizer;
    }

    /**
     * @return a new vector with one entry per vocabulary term
     */
    public double[] vectorize(final String text) {
        return vectorizeTokens(normalizer.normalize(text));
    }

    /**
     * Vectorizes tokens that were already produced by {@link TextNormalizer#normalize(String)}.
     */
    public double[] vectorizeTokens(final List<String> tokens) {
        final Map<String, Integer> termCounts = new HashMap<>();
        for (final String token : tokens) {
            termCounts.merge(token, 1, Integer::sum);
        }

        final double[] features = new double[bundle.size()];
        double sumSquares = 0.0;
        for (final Map.Entry<String, Integer> entry : termCounts.entrySet()) {
            final OptionalInt index = bundle.indexOf(entry.getKey());
            if (index.isPresent()) {
                final double value = entry.getValue() * bundle.idf(index.getAsInt());
                features[index.getAsInt()] = value;
                sumSquares += value * value;
            }
        }

        if (sumSquares > 0) {
            final double norm = Math.sqrt(sumSquares);
            for (int i = 0; i < features.length; i++) {
                features[i] = features[i] / norm;
            }
        }
        return features;
    }

    public ModelBundle getBundle() {
        return bundle;
    }
}
