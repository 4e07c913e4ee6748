package de.mirkosertic.newsclassifier.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;

/**
 * Analyzer reproducing the preprocessing the classifier was trained with.
 *
 * <p>Token chain: {@code AsciiLetterTokenizer -> LowerCaseFilter -> StopFilter(EnglishStopWords) -> PorterStemmingFilter}</p>
 *
 * <p>Stopwords are matched against the lowercase surface form before stemming. A stem that
 * happens to equal a stopword is kept.</p>
 */
public class NewsTextAnalyzer extends Analyzer {

    private final Stemmer stemmer;

    public NewsTextAnalyzer(final Stemmer stemmer) {
        this.stemmer = stemmer;
    }

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new AsciiLetterTokenizer();
        TokenStream stream = new LowerCaseFilter(tokenizer);
        stream = new StopFilter(stream, EnglishStopWords.asCharArraySet());
        stream = new PorterStemmingFilter(stream, stemmer);
        return new TokenStreamComponents(tokenizer, stream);
    }
}
