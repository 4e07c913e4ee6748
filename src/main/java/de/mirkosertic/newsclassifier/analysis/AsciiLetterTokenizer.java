package de.mirkosertic.newsclassifier.analysis;

import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.util.CharTokenizer;

/**
 * Tokenizer that emits maximal runs of the ASCII letters {@code A-Z} and {@code a-z}.
 *
 * <p>Every other code point, including digits, punctuation, apostrophes, accented and
 * non-Latin letters, acts as a separator. Unlike {@code LetterTokenizer} this does not use
 * {@link Character#isLetter(int)}, which would keep letters outside the ASCII range.</p>
 *
 * <p>The maximum token length is raised to the Lucene limit of
 * {@link StandardTokenizer#MAX_TOKEN_LENGTH_LIMIT} characters. Longer letter runs are split
 * into tokens of at most that length.</p>
 */
public final class AsciiLetterTokenizer extends CharTokenizer {

    public AsciiLetterTokenizer() {
        super(DEFAULT_TOKEN_ATTRIBUTE_FACTORY, StandardTokenizer.MAX_TOKEN_LENGTH_LIMIT);
    }

    @Override
    protected boolean isTokenChar(final int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
