package de.mirkosertic.newsclassifier.classify;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Output of {@link LogisticRegressionClassifier#predict(double[])}.
 *
 * @param label           1 for likely fake, 0 for likely reliable
 * @param score           the linear score before the sigmoid
 * @param fakeProbability sigmoid of the score
 * @param realProbability {@code 1 - fakeProbability}
 * @param confidence      the larger of the two probabilities
 */
public record Prediction(
        int label,
        double score,
        double fakeProbability,
        double realProbability,
        double confidence
) {

    public static final int LABEL_REAL = 0;
    public static final int LABEL_FAKE = 1;

    public static Prediction fromScore(final double score) {
        final double probability = 1.0 / (1.0 + Math.exp(-score));
        final int label = probability > 0.5 ? LABEL_FAKE : LABEL_REAL;
        return new Prediction(
                label,
                score,
                probability,
                1.0 - probability,
                Math.max(probability, 1.0 - probability));
    }

    @JsonIgnore
    public boolean isFake() {
        return label == LABEL_FAKE;
    }

    /**
     * Maps the prediction to a verdict; predictions with a confidence below the threshold
     * are {@link Verdict#UNCERTAIN}.
     */
    public Verdict verdict(final double uncertaintyThreshold) {
        if (confidence < uncertaintyThreshold) {
            return Verdict.UNCERTAIN;
        }
        return isFake() ? Verdict.LIKELY_FAKE : Verdict.LIKELY_RELIABLE;
    }
}
