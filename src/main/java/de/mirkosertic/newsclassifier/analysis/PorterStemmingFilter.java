package de.mirkosertic.newsclassifier.analysis;

import org.apache.lucene.analysis.TokenFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;

/**
 * Token filter that replaces each term with the output of a {@link Stemmer}.
 *
 * <p>Lucene's own {@code PorterStemFilter} implements the original algorithm without the
 * NLTK extensions and therefore produces different stems for words like {@code dying},
 * {@code news} or {@code flies}.</p>
 */
public final class PorterStemmingFilter extends TokenFilter {

    private final CharTermAttribute termAtt = addAttribute(CharTermAttribute.class);
    private final Stemmer stemmer;

    public PorterStemmingFilter(final TokenStream input, final Stemmer stemmer) {
        super(input);
        this.stemmer = stemmer;
    }

    @Override
    public boolean incrementToken() throws IOException {
        if (!input.incrementToken()) {
            return false;
        }
        final String stemmed = stemmer.stem(termAtt.toString());
        termAtt.setEmpty().append(stemmed);
        return true;
    }
}
