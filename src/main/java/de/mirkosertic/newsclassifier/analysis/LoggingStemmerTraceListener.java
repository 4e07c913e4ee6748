package de.mirkosertic.newsclassifier.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every stemming step that changed the word to the TRACE log.
 */
public class LoggingStemmerTraceListener implements StemmerTraceListener {

    private static final Logger logger = LoggerFactory.getLogger(LoggingStemmerTraceListener.class);

    @Override
    public void onStep(final String word, final String step, final String before, final String after) {
        if (logger.isTraceEnabled() && !before.equals(after)) {
            logger.trace("stem({}) step {}: {} -> {}", word, step, before, after);
        }
    }
}
