package de.mirkosertic.newsclassifier.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a {@link ModelBundle} from the JSON export of the training pipeline.
 *
 * <p>Expected layout:</p>
 * <pre>
 * {
 *   "vocabulary":   ["report", "fake", ...],
 *   "idf_values":   [1.0, 2.0, ...],
 *   "coefficients": [0.5, -1.2, ...],
 *   "intercept":    0.1
 * }
 * </pre>
 *
 * <p>Unknown properties are ignored. Malformed JSON surfaces as {@link IOException}; a document
 * that parses but does not describe a valid bundle raises {@link InvalidModelBundleException}.</p>
 */
public class ModelBundleLoader {

    private static final Logger logger = LoggerFactory.getLogger(ModelBundleLoader.class);

    private final ObjectMapper objectMapper;

    public ModelBundleLoader() {
        this(new ObjectMapper().enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES));
    }

    public ModelBundleLoader(final ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ModelBundle load(final Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new FileNotFoundException("Model file not found: " + path);
        }
        try (final InputStream is = Files.newInputStream(path)) {
            final ModelBundle bundle = load(is);
            logger.info("Loaded model from {}: {}", path, bundle);
            return bundle;
        }
    }

    /**
     * Loads a bundle from the classpath, e.g. a model packaged with the application.
     */
    public ModelBundle loadResource(final String resourceName) throws IOException {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(resourceName)) {
            if (is == null) {
                throw new FileNotFoundException("Model resource not found on classpath: " + resourceName);
            }
            final ModelBundle bundle = load(is);
            logger.info("Loaded model from classpath resource {}: {}", resourceName, bundle);
            return bundle;
        }
    }

    /**
     * Parses a bundle from the stream.
     */
    public ModelBundle load(final InputStream is) throws IOException {
        final ModelParameters parameters = objectMapper.readValue(is, ModelParameters.class);
        if (parameters == null) {
            throw new InvalidModelBundleException("Model document is empty");
        }
        if (parameters.intercept() == null) {
            throw new InvalidModelBundleException("Intercept is missing");
        }
        return ModelBundle.of(
                parameters.vocabulary(),
                parameters.idfValues(),
                parameters.coefficients(),
                parameters.intercept());
    }
}
