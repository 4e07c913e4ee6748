package de.mirkosertic.newsclassifier.analysis;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A single suffix rewrite rule of the Porter algorithm.
 *
 * <p>Rule lists are evaluated with first-match-commit semantics by {@link #applyFirst(String, List)}:
 * the first rule whose suffix matches decides the outcome. If its condition holds the suffix is
 * replaced, otherwise the word is returned unchanged and later rules are not consulted.</p>
 *
 * <p>The double consonant rule kind matches any word ending in a doubled consonant and
 * replaces the pair with a single instance of that consonant.</p>
 *
 * @param suffix                  the suffix to match, may be empty to match every word
 * @param replacement             text appended to the stem when the rule fires
 * @param condition               optional guard evaluated against the stem
 * @param collapseDoubleConsonant whether this is the double consonant rule kind
 */
record SuffixRule(String suffix,
                  String replacement,
                  @Nullable Condition condition,
                  boolean collapseDoubleConsonant) {

    /**
     * Guard for a rule.
     */
    @FunctionalInterface
    interface Condition {

        /**
         * @param stem the word with the matched suffix removed
         * @param word the complete word the rule is applied to
         */
        boolean test(String stem, String word);
    }

    static SuffixRule of(final String suffix, final String replacement) {
        return new SuffixRule(suffix, replacement, null, false);
    }

    static SuffixRule of(final String suffix, final String replacement, final Condition condition) {
        return new SuffixRule(suffix, replacement, condition, false);
    }

    static SuffixRule doubleConsonant(final Condition condition) {
        return new SuffixRule("", "", condition, true);
    }

    static String applyFirst(final String word, final List<SuffixRule> rules) {
        for (final SuffixRule rule : rules) {
            if (rule.collapseDoubleConsonant) {
                if (PorterStemmer.endsDoubleConsonant(word)) {
                    final String stem = word.substring(0, word.length() - 2);
                    if (rule.accepts(stem, word)) {
                        return stem + word.charAt(word.length() - 1);
                    }
                    return word;
                }
                continue;
            }
            if (word.endsWith(rule.suffix)) {
                final String stem = word.substring(0, word.length() - rule.suffix.length());
                if (rule.accepts(stem, word)) {
                    return stem + rule.replacement;
                }
                return word;
            }
        }
        return word;
    }

    private boolean accepts(final String stem, final String word) {
        return condition == null || condition.test(stem, word);
    }
}
