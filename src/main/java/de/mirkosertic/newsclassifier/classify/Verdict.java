package de.mirkosertic.newsclassifier.classify;

/**
 * User-facing reading of a {@link Prediction}.
 */
public enum Verdict {

    LIKELY_FAKE,
    LIKELY_RELIABLE,
    /**
     * The model leans one way, but its confidence is below the configured threshold.
     */
    UNCERTAIN
}
