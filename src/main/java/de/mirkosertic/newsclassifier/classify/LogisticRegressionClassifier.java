package de.mirkosertic.newsclassifier.classify;

import de.mirkosertic.newsclassifier.model.ModelBundle;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Logistic regression over TF-IDF feature vectors.
 *
 * <p>Stateless apart from the immutable {@link ModelBundle}; safe for concurrent use.</p>
 */
public class LogisticRegressionClassifier {

    private final ModelBundle bundle;

    public LogisticRegressionClassifier(final ModelBundle bundle) {
        this.bundle = bundle;
    }

    /**
     * Scores a feature vector produced by {@link TfIdfVectorizer} for the same bundle.
     *
     * @throws IllegalArgumentException if the vector length differs from the vocabulary size
     */
    public Prediction predict(final double[] features) {
        return Prediction.fromScore(score(features));
    }

    /**
     * The linear score {@code intercept + features . coefficients}.
     */
    public double score(final double[] features) {
        checkLength(features);
        double score = bundle.intercept();
        for (int i = 0; i < features.length; i++) {
            score += features[i] * bundle.coefficient(i);
        }
        return score;
    }

    /**
     * Predicts and lists the {@code topN} features with the largest TF-IDF values together with
     * their contribution to the score.
     */
    public PredictionExplanation explain(final double[] features, final int topN) {
        checkLength(features);
        if (topN < 0) {
            throw new IllegalArgumentException("topN must not be negative: " + topN);
        }

        final List<FeatureContribution> present = new ArrayList<>();
        double totalContribution = 0.0;
        for (int i = 0; i < features.length; i++) {
            if (features[i] != 0.0) {
                final double coefficient = bundle.coefficient(i);
                final double contribution = features[i] * coefficient;
                totalContribution += contribution;
                present.add(new FeatureContribution(bundle.term(i), i, features[i], coefficient, contribution));
            }
        }

        final List<FeatureContribution> top = present.stream()
                .sorted(Comparator.comparingDouble(FeatureContribution::tfidf).reversed()
                        .thenComparingInt(FeatureContribution::index))
                .limit(topN)
                .toList();

        return new PredictionExplanation(
                predict(features),
                bundle.intercept(),
                totalContribution,
                present.size(),
                top);
    }

    private void checkLength(final double[] features) {
        if (features.length != bundle.size()) {
            throw new IllegalArgumentException(String.format(
                    "Feature vector length %d does not match vocabulary size %d", features.length, bundle.size()));
        }
    }
}
