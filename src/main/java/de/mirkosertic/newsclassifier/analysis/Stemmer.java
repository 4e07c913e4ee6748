package de.mirkosertic.newsclassifier.analysis;

/**
 * Maps a single lowercase alphabetic token to its stem.
 *
 * <p>Implementations must be deterministic and safe for concurrent use.</p>
 */
public interface Stemmer {

    String stem(String word);
}
