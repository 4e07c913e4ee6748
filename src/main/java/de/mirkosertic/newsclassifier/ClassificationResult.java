package de.mirkosertic.newsclassifier;

import de.mirkosertic.newsclassifier.classify.Prediction;
import de.mirkosertic.newsclassifier.classify.PredictionExplanation;
import de.mirkosertic.newsclassifier.classify.Verdict;
import org.jspecify.annotations.Nullable;

/**
 * Classification of one text.
 *
 * @param source          where the text came from (file name or {@code "stdin"}), null for API calls
 * @param label           1 for likely fake, 0 for likely reliable
 * @param verdict         the label banded by the uncertainty threshold
 * @param fakeProbability probability that the text is fabricated
 * @param realProbability probability that the text is reliable
 * @param confidence      the larger of both probabilities
 * @param tokenCount      number of stemmed tokens after stopword removal
 * @param nonZeroFeatures number of vocabulary terms found in the text
 * @param explanation     score breakdown, only present when requested
 */
public record ClassificationResult(
        @Nullable String source,
        int label,
        Verdict verdict,
        double fakeProbability,
        double realProbability,
        double confidence,
        int tokenCount,
        int nonZeroFeatures,
        @Nullable PredictionExplanation explanation
) {

    public static ClassificationResult of(final Prediction prediction,
                                          final double uncertaintyThreshold,
                                          final int tokenCount,
                                          final int nonZeroFeatures,
                                          final @Nullable PredictionExplanation explanation) {
        return new ClassificationResult(
                null,
                prediction.label(),
                prediction.verdict(uncertaintyThreshold),
                prediction.fakeProbability(),
                prediction.realProbability(),
                prediction.confidence(),
                tokenCount,
                nonZeroFeatures,
                explanation);
    }

    public ClassificationResult withSource(final String newSource) {
        return new ClassificationResult(newSource, label, verdict, fakeProbability, realProbability,
                confidence, tokenCount, nonZeroFeatures, explanation);
    }
}
