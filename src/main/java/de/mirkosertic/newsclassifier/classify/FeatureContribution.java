package de.mirkosertic.newsclassifier.classify;

/**
 * Share of a single vocabulary term in a prediction score.
 *
 * @param term         the stemmed vocabulary term
 * @param index        its feature index
 * @param tfidf        the normalized TF-IDF value in the feature vector
 * @param coefficient  the model coefficient of the term
 * @param contribution {@code tfidf * coefficient}
 */
public record FeatureContribution(
        String term,
        int index,
        double tfidf,
        double coefficient,
        double contribution
) {
}
