package de.mirkosertic.newsclassifier.analysis;

import java.util.List;
import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Porter stemmer in the NLTK extensions mode.
 *
 * <p>The classifier vocabulary was built with this exact variant, so every rule, including
 * the historical quirks, has to be reproduced as is. Differences to the original 1980 algorithm:</p>
 * <ul>
 *   <li>irregular forms from {@link IrregularForms} are resolved before any rule</li>
 *   <li>words of one or two characters are never stemmed</li>
 *   <li>{@code ies} and {@code ied} on four letter words become {@code ie} ({@code dies -> die})</li>
 *   <li>step 1c only rewrites {@code y} after a consonant that is not the first letter</li>
 *   <li>{@code alli} is reduced recursively at the start of step 2</li>
 *   <li>the {@code logi} guard measures the word minus its last three characters</li>
 *   <li>a two letter vowel-consonant stem counts as ending in consonant-vowel-consonant</li>
 * </ul>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public class PorterStemmer implements Stemmer {

    private static final List<SuffixRule> STEP_1A = List.of(
            SuffixRule.of("sses", "ss"),
            SuffixRule.of("ies", "i"),
            SuffixRule.of("ss", "ss"),
            SuffixRule.of("s", "")
    );

    private static final List<SuffixRule> STEP_1B_CLEANUP = List.of(
            SuffixRule.of("at", "ate"),
            SuffixRule.of("bl", "ble"),
            SuffixRule.of("iz", "ize"),
            SuffixRule.doubleConsonant((stem, word) -> {
                final char last = word.charAt(word.length() - 1);
                return last != 'l' && last != 's' && last != 'z';
            }),
            SuffixRule.of("", "e", (stem, word) -> measure(stem) == 1 && endsCvc(stem))
    );

    private static final List<SuffixRule> STEP_1C = List.of(
            SuffixRule.of("y", "i", (stem, word) -> stem.length() > 1 && isConsonant(stem, stem.length() - 1))
    );

    private static final SuffixRule.Condition POSITIVE_MEASURE = (stem, word) -> hasPositiveMeasure(stem);

    private static final List<SuffixRule> STEP_2 = List.of(
            SuffixRule.of("ational", "ate", POSITIVE_MEASURE),
            SuffixRule.of("tional", "tion", POSITIVE_MEASURE),
            SuffixRule.of("enci", "ence", POSITIVE_MEASURE),
            SuffixRule.of("anci", "ance", POSITIVE_MEASURE),
            SuffixRule.of("izer", "ize", POSITIVE_MEASURE),
            SuffixRule.of("bli", "ble", POSITIVE_MEASURE),
            SuffixRule.of("alli", "al", POSITIVE_MEASURE),
            SuffixRule.of("entli", "ent", POSITIVE_MEASURE),
            SuffixRule.of("eli", "e", POSITIVE_MEASURE),
            SuffixRule.of("ousli", "ous", POSITIVE_MEASURE),
            SuffixRule.of("ization", "ize", POSITIVE_MEASURE),
            SuffixRule.of("ation", "ate", POSITIVE_MEASURE),
            SuffixRule.of("ator", "ate", POSITIVE_MEASURE),
            SuffixRule.of("alism", "al", POSITIVE_MEASURE),
            SuffixRule.of("iveness", "ive", POSITIVE_MEASURE),
            SuffixRule.of("fulness", "ful", POSITIVE_MEASURE),
            SuffixRule.of("ousness", "ous", POSITIVE_MEASURE),
            SuffixRule.of("aliti", "al", POSITIVE_MEASURE),
            SuffixRule.of("iviti", "ive", POSITIVE_MEASURE),
            SuffixRule.of("biliti", "ble", POSITIVE_MEASURE),
            SuffixRule.of("fulli", "ful", POSITIVE_MEASURE),
            // the "l" of "logi" stays with the stem
            SuffixRule.of("logi", "log", (stem, word) -> hasPositiveMeasure(word.substring(0, word.length() - 3)))
    );

    private static final List<SuffixRule> STEP_3 = List.of(
            SuffixRule.of("icate", "ic", POSITIVE_MEASURE),
            SuffixRule.of("ative", "", POSITIVE_MEASURE),
            SuffixRule.of("alize", "al", POSITIVE_MEASURE),
            SuffixRule.of("iciti", "ic", POSITIVE_MEASURE),
            SuffixRule.of("ical", "ic", POSITIVE_MEASURE),
            SuffixRule.of("ful", "", POSITIVE_MEASURE),
            SuffixRule.of("ness", "", POSITIVE_MEASURE)
    );

    private static final SuffixRule.Condition MEASURE_ABOVE_ONE = (stem, word) -> measure(stem) > 1;

    private static final List<SuffixRule> STEP_4 = List.of(
            SuffixRule.of("al", "", MEASURE_ABOVE_ONE),
            SuffixRule.of("ance", "", MEASURE_ABOVE_ONE),
            SuffixRule.of("ence", "", MEASURE_ABOVE_ONE),
            SuffixRule.of("er", "", MEASURE_ABOVE_ONE),
            SuffixRule.of("ic", "", MEASURE_ABOVE_ONE),
            SuffixRule.of("able", "", MEASURE_ABOVE_ONE),
            SuffixRule.of("ible", "", MEASURE_ABOVE_ONE),
            SuffixRule.of("ant", "", MEASURE_ABOVE_ONE),
            SuffixRule.of("ement", "", MEASURE_ABOVE_ONE),
            SuffixRule.of("ment", "", MEASURE_ABOVE_ONE),
            SuffixRule.of("ent", "", MEASURE_ABOVE_ONE),
            SuffixRule.of("ion", "", (stem, word) -> measure(stem) > 1 && endsWithSOrT(stem)),
            SuffixRule.of("ou", "", MEASURE_ABOVE_ONE),
            SuffixRule.of("ism", "", MEASURE_ABOVE_ONE),
            SuffixRule.of("ate", "", MEASURE_ABOVE_ONE),
            SuffixRule.of("iti", "", MEASURE_ABOVE_ONE),
            SuffixRule.of("ous", "", MEASURE_ABOVE_ONE),
            SuffixRule.of("ive", "", MEASURE_ABOVE_ONE),
            SuffixRule.of("ize", "", MEASURE_ABOVE_ONE)
    );

    private static final List<SuffixRule> STEP_5B = List.of(
            SuffixRule.of("ll", "l", (stem, word) -> measure(word.substring(0, word.length() - 1)) > 1)
    );

    private enum Step {
        STEP_1A("1a", PorterStemmer::step1a),
        STEP_1B("1b", PorterStemmer::step1b),
        STEP_1C("1c", PorterStemmer::step1c),
        STEP_2("2", PorterStemmer::step2),
        STEP_3("3", PorterStemmer::step3),
        STEP_4("4", PorterStemmer::step4),
        STEP_5A("5a", PorterStemmer::step5a),
        STEP_5B("5b", PorterStemmer::step5b);

        private final String label;
        private final UnaryOperator<String> function;

        Step(final String label, final UnaryOperator<String> function) {
            this.label = label;
            this.function = function;
        }
    }

    private final StemmerTraceListener traceListener;

    public PorterStemmer() {
        this(StemmerTraceListener.NONE);
    }

    public PorterStemmer(final StemmerTraceListener traceListener) {
        this.traceListener = traceListener;
    }

    @Override
    public String stem(final String word) {
        final String lower = word.toLowerCase(Locale.ROOT);

        final String irregular = IrregularForms.lookup(lower);
        if (irregular != null) {
            return irregular;
        }

        if (lower.length() <= 2) {
            return lower;
        }

        String current = lower;
        for (final Step step : Step.values()) {
            final String next = step.function.apply(current);
            traceListener.onStep(lower, step.label, current, next);
            current = next;
        }
        return current;
    }

    // Character classification

    static boolean isConsonant(final String word, final int i) {
        final char c = word.charAt(i);
        if (c == 'a' || c == 'e' || c == 'i' || c == 'o' || c == 'u') {
            return false;
        }
        if (c == 'y') {
            if (i == 0) {
                return true;
            }
            return !isConsonant(word, i - 1);
        }
        return true;
    }

    /**
     * Number of vowel-consonant transitions in the word, the {@code m} of Porter's paper.
     */
    static int measure(final String stem) {
        int count = 0;
        boolean previousVowel = false;
        for (int i = 0; i < stem.length(); i++) {
            final boolean consonant = isConsonant(stem, i);
            if (consonant && previousVowel) {
                count++;
            }
            previousVowel = !consonant;
        }
        return count;
    }

    static boolean hasPositiveMeasure(final String stem) {
        return measure(stem) > 0;
    }

    static boolean containsVowel(final String stem) {
        for (int i = 0; i < stem.length(); i++) {
            if (!isConsonant(stem, i)) {
                return true;
            }
        }
        return false;
    }

    static boolean endsDoubleConsonant(final String word) {
        final int len = word.length();
        return len >= 2
                && word.charAt(len - 1) == word.charAt(len - 2)
                && isConsonant(word, len - 1);
    }

    static boolean endsCvc(final String word) {
        final int len = word.length();
        if (len >= 3
                && isConsonant(word, len - 3)
                && !isConsonant(word, len - 2)
                && isConsonant(word, len - 1)) {
            final char last = word.charAt(len - 1);
            return last != 'w' && last != 'x' && last != 'y';
        }
        return len == 2 && !isConsonant(word, 0) && isConsonant(word, 1);
    }

    private static boolean endsWithSOrT(final String stem) {
        if (stem.isEmpty()) {
            return false;
        }
        final char last = stem.charAt(stem.length() - 1);
        return last == 's' || last == 't';
    }

    private static String replaceSuffix(final String word, final String suffix, final String replacement) {
        return word.substring(0, word.length() - suffix.length()) + replacement;
    }

    // Steps

    static String step1a(final String word) {
        if (word.endsWith("ies") && word.length() == 4) {
            return replaceSuffix(word, "ies", "ie");
        }
        return SuffixRule.applyFirst(word, STEP_1A);
    }

    static String step1b(final String word) {
        if (word.endsWith("ied")) {
            return replaceSuffix(word, "ied", word.length() == 4 ? "ie" : "i");
        }

        if (word.endsWith("eed")) {
            final String stem = replaceSuffix(word, "eed", "");
            if (measure(stem) > 0) {
                return stem + "ee";
            }
            return word;
        }

        String stripped = null;
        for (final String suffix : List.of("ed", "ing")) {
            if (word.endsWith(suffix)) {
                final String candidate = replaceSuffix(word, suffix, "");
                if (containsVowel(candidate)) {
                    stripped = candidate;
                    break;
                }
            }
        }
        if (stripped == null) {
            return word;
        }
        return SuffixRule.applyFirst(stripped, STEP_1B_CLEANUP);
    }

    static String step1c(final String word) {
        return SuffixRule.applyFirst(word, STEP_1C);
    }

    static String step2(final String word) {
        if (word.endsWith("alli") && hasPositiveMeasure(replaceSuffix(word, "alli", ""))) {
            return step2(replaceSuffix(word, "alli", "al"));
        }
        return SuffixRule.applyFirst(word, STEP_2);
    }

    static String step3(final String word) {
        return SuffixRule.applyFirst(word, STEP_3);
    }

    static String step4(final String word) {
        return SuffixRule.applyFirst(word, STEP_4);
    }

    static String step5a(final String word) {
        if (word.endsWith("e")) {
            final String stem = replaceSuffix(word, "e", "");
            final int m = measure(stem);
            if (m > 1) {
                return stem;
            }
            if (m == 1 && !endsCvc(stem)) {
                return stem;
            }
        }
        return word;
    }

    static String step5b(final String word) {
        return SuffixRule.applyFirst(word, STEP_5B);
    }
}
