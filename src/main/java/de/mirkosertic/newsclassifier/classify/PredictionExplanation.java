package de.mirkosertic.newsclassifier.classify;

import java.util.List;

/**
 * Breakdown of a prediction score into intercept and feature contributions.
 *
 * @param prediction        the prediction being explained
 * @param intercept         the model intercept
 * @param totalContribution sum of all feature contributions, {@code score - intercept}
 * @param nonZeroFeatures   number of vocabulary terms present in the text
 * @param topFeatures       the features with the highest TF-IDF values, highest first
 */
public record PredictionExplanation(
        Prediction prediction,
        double intercept,
        double totalContribution,
        int nonZeroFeatures,
        List<FeatureContribution> topFeatures
) {
}
