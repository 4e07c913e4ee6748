package de.mirkosertic.newsclassifier.analysis;

import org.apache.lucene.analysis.CharArraySet;

import java.util.Set;

/**
 * The NLTK English stopword list the classifier was trained with.
 *
 * <p>Entries are lowercase; lookups are case-sensitive. Contraction forms such as
 * {@code "don't"} are part of the list even though the letter-only tokenizer can
 * never produce them, so the set stays identical to the training side.</p>
 */
public final class EnglishStopWords {

    public static final Set<String> WORDS = Set.of(
            "i", "me", "my", "myself", "we", "our", "ours", "ourselves", "you", "you're",
            "you've", "you'll", "you'd", "your", "yours", "yourself", "yourselves", "he",
            "him", "his", "himself", "she", "she's", "her", "hers", "herself", "it", "it's",
            "its", "itself", "they", "them", "their", "theirs", "themselves", "what", "which",
            "who", "whom", "this", "that", "that'll", "these", "those", "am", "is", "are",
            "was", "were", "be", "been", "being", "have", "has", "had", "having", "do",
            "does", "did", "doing", "a", "an", "the", "and", "but", "if", "or", "because",
            "as", "until", "while", "of", "at", "by", "for", "with", "about", "against",
            "between", "into", "through", "during", "before", "after", "above", "below",
            "to", "from", "up", "down", "in", "out", "on", "off", "over", "under", "again",
            "further", "then", "once", "here", "there", "when", "where", "why", "how", "all",
            "both", "each", "few", "more", "most", "other", "some", "such", "no", "nor",
            "not", "only", "own", "same", "so", "than", "too", "very", "s", "t", "can",
            "will", "just", "don", "don't", "should", "should've", "now", "d", "ll", "m",
            "o", "re", "ve", "y", "ain", "aren", "aren't", "couldn", "couldn't", "didn",
            "didn't", "doesn", "doesn't", "hadn", "hadn't", "hasn", "hasn't", "haven",
            "haven't", "isn", "isn't", "ma", "mightn", "mightn't", "mustn", "mustn't",
            "needn", "needn't", "shan", "shan't", "shouldn", "shouldn't", "wasn", "wasn't",
            "weren", "weren't", "won", "won't", "wouldn", "wouldn't"
    );

    private static final CharArraySet CHAR_ARRAY_SET =
            CharArraySet.unmodifiableSet(new CharArraySet(WORDS, false));

    private EnglishStopWords() {
        // Utility class, no instances
    }

    public static boolean isStopWord(final String token) {
        return WORDS.contains(token);
    }

    /**
     * Returns the list as a Lucene {@link CharArraySet} for use with a stop filter.
     */
    public static CharArraySet asCharArraySet() {
        return CHAR_ARRAY_SET;
    }
}
