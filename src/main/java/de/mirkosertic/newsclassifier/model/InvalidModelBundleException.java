package de.mirkosertic.newsclassifier.model;

/**
 * Thrown when model parameters are structurally unusable, e.g. when the vocabulary,
 * IDF and coefficient arrays differ in length.
 *
 * <p>An invalid bundle is never used for inference.</p>
 */
public class InvalidModelBundleException extends RuntimeException {

    public InvalidModelBundleException(final String message) {
        super(message);
    }
}
