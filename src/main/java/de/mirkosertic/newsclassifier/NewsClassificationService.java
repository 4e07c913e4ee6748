package de.mirkosertic.newsclassifier;

import de.mirkosertic.newsclassifier.analysis.CachingStemmer;
import de.mirkosertic.newsclassifier.analysis.LoggingStemmerTraceListener;
import de.mirkosertic.newsclassifier.analysis.PorterStemmer;
import de.mirkosertic.newsclassifier.analysis.Stemmer;
import de.mirkosertic.newsclassifier.analysis.StemmerCacheStats;
import de.mirkosertic.newsclassifier.analysis.StemmerTraceListener;
import de.mirkosertic.newsclassifier.analysis.TextNormalizer;
import de.mirkosertic.newsclassifier.classify.LogisticRegressionClassifier;
import de.mirkosertic.newsclassifier.classify.Prediction;
import de.mirkosertic.newsclassifier.classify.PredictionExplanation;
import de.mirkosertic.newsclassifier.classify.TfIdfVectorizer;
import de.mirkosertic.newsclassifier.config.ApplicationConfig;
import de.mirkosertic.newsclassifier.model.ModelBundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.List;

/**
 * Entry point to the classification pipeline for one {@link ModelBundle}:
 * normalize, vectorize, predict.
 *
 * <p>Create one instance per process and share it; all methods are thread-safe and only
 * allocate per-call state.</p>
 */
public class NewsClassificationService implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(NewsClassificationService.class);

    private final ModelBundle bundle;
    private final TextNormalizer normalizer;
    private final TfIdfVectorizer vectorizer;
    private final LogisticRegressionClassifier classifier;
    private final double uncertaintyThreshold;
    private final int topFeatures;

    public NewsClassificationService(final ModelBundle bundle,
                                     final TextNormalizer normalizer,
                                     final double uncertaintyThreshold,
                                     final int topFeatures) {
        this.bundle = bundle;
        this.normalizer = normalizer;
        this.vectorizer = new TfIdfVectorizer(bundle, normalizer);
        this.classifier = new LogisticRegressionClassifier(bundle);
        this.uncertaintyThreshold = uncertaintyThreshold;
        this.topFeatures = topFeatures;
    }

    /**
     * Creates a service with the default settings of {@link ApplicationConfig#defaults()}.
     */
    public static NewsClassificationService create(final ModelBundle bundle) {
        return create(bundle, ApplicationConfig.defaults());
    }

    public static NewsClassificationService create(final ModelBundle bundle, final ApplicationConfig config) {
        final StemmerTraceListener traceListener = config.isTraceStemming()
                ? new LoggingStemmerTraceListener()
                : StemmerTraceListener.NONE;
        Stemmer stemmer = new PorterStemmer(traceListener);
        if (config.getStemCacheSize() > 0) {
            stemmer = new CachingStemmer(stemmer, config.getStemCacheSize(), new StemmerCacheStats());
        }
        logger.debug("Creating classification service for {}", bundle);
        return new NewsClassificationService(
                bundle,
                new TextNormalizer(stemmer),
                config.getUncertaintyThreshold(),
                config.getTopFeatures());
    }

    public List<String> normalize(final String text) {
        return normalizer.normalize(text);
    }

    public double[] vectorize(final String text) {
        return vectorizer.vectorize(text);
    }

    public Prediction predict(final double[] features) {
        return classifier.predict(features);
    }

    public ClassificationResult classify(final String text) {
        return classify(text, false);
    }

    /**
     * Runs the whole pipeline on the text.
     *
     * @param text    the article text
     * @param explain whether to attach the score breakdown
     */
    public ClassificationResult classify(final String text, final boolean explain) {
        final long start = System.nanoTime();

        final List<String> tokens = normalizer.normalize(text);
        final double[] features = vectorizer.vectorizeTokens(tokens);

        final Prediction prediction;
        final PredictionExplanation explanation;
        final int nonZeroFeatures;
        if (explain) {
            explanation = classifier.explain(features, topFeatures);
            prediction = explanation.prediction();
            nonZeroFeatures = explanation.nonZeroFeatures();
        } else {
            explanation = null;
            prediction = classifier.predict(features);
            nonZeroFeatures = countNonZero(features);
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Classified text: chars={}, tokens={}, nonZeroFeatures={}, score={}, fakeProbability={}, took {}us",
                    text.length(), tokens.size(), nonZeroFeatures, prediction.score(), prediction.fakeProbability(),
                    (System.nanoTime() - start) / 1_000);
        }

        return ClassificationResult.of(prediction, uncertaintyThreshold, tokens.size(), nonZeroFeatures, explanation);
    }

    private static int countNonZero(final double[] features) {
        int count = 0;
        for (final double feature : features) {
            if (feature != 0.0) {
                count++;
            }
        }
        return count;
    }

    public ModelBundle getBundle() {
        return bundle;
    }

    @Override
    public void close() {
        normalizer.close();
    }
}
