package de.mirkosertic.newsclassifier.analysis;

/**
 * Observer for the individual rewrite steps of {@link PorterStemmer}.
 *
 * <p>Called once per step and word, including steps that leave the word unchanged.
 * Listeners are invoked on the stemming thread and must not block.</p>
 */
@FunctionalInterface
public interface StemmerTraceListener {

    StemmerTraceListener NONE = (word, step, before, after) -> {
    };

    /**
     * @param word   the original input word
     * @param step   the step name, e.g. {@code "1a"} or {@code "5b"}
     * @param before the word as it entered the step
     * @param after  the word as it left the step
     */
    void onStep(String word, String step, String before, String after);
}
