package de.mirkosertic.newsclassifier.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns raw text into the ordered list of stemmed, stopword-free tokens the vectorizer counts.
 *
 * <p>Order and multiplicity of the tokens are preserved. The underlying {@link Analyzer}
 * reuses its token stream components per thread, so a single instance can be shared by
 * concurrent callers.</p>
 */
public class TextNormalizer implements Closeable {

    private static final String FIELD_NAME = "content";

    private final Analyzer analyzer;

    public TextNormalizer(final Stemmer stemmer) {
        this(new NewsTextAnalyzer(stemmer));
    }

    public TextNormalizer(final Analyzer analyzer) {
        this.analyzer = analyzer;
    }

    /**
     * Normalizes the text.
     *
     * @param text the text to normalize, must not be null
     * @return the stemmed tokens in input order, empty if the text has no content words
     */
    public List<String> normalize(final String text) {
        Objects.requireNonNull(text, "text must not be null");

        final List<String> tokens = new ArrayList<>();
        try (final TokenStream ts = analyzer.tokenStream(FIELD_NAME, text)) {
            final CharTermAttribute termAttr = ts.addAttribute(CharTermAttribute.class);
            ts.reset();
            while (ts.incrementToken()) {
                if (termAttr.length() > 0) {
                    tokens.add(termAttr.toString());
                }
            }
            ts.end();
        } catch (final IOException e) {
            // Reading from an in-memory string does not fail
            throw new UncheckedIOException("Failed to analyze text", e);
        }
        return tokens;
    }

    @Override
    public void close() {
        analyzer.close();
    }
}
