package de.mirkosertic.newsclassifier.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Central configuration for the news classifier.
 * Loads configuration from YAML files, system properties and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.newsclassifier/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    static final String ENV_MODEL_PATH = "NEWSCLASSIFIER_MODEL_PATH";
    static final String PROP_MODEL_PATH = "newsclassifier.model.path";
    static final String PROP_PROFILE = "newsclassifier.profile";
    private static final String CONFIG_DIR = ".newsclassifier";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Model settings
    private @Nullable String modelPath;

    // Classification settings
    private double uncertaintyThreshold = 0.6;
    private int topFeatures = 20;

    // Stemming settings
    private long stemCacheSize = 50_000;
    private boolean traceStemming = false;

    // Profile settings
    private boolean deployedMode = false;

    ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        config.loadFromClasspath(DEFAULT_CONFIG_FILE);
        config.loadFromFile(getUserConfigPath());
        config.applyOverrides(System.getenv(ENV_MODEL_PATH), System.getProperty(PROP_MODEL_PATH));
        config.determineProfile();
        config.validate();

        logger.info("Configuration loaded: modelPath={}, uncertaintyThreshold={}, topFeatures={}, stemCacheSize={}, deployedMode={}",
                config.modelPath, config.uncertaintyThreshold, config.topFeatures, config.stemCacheSize, config.deployedMode);

        return config;
    }

    /**
     * Configuration with built-in defaults only.
     */
    public static ApplicationConfig defaults() {
        return new ApplicationConfig();
    }

    void loadFromClasspath(final String resourceName) {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(resourceName)) {
            if (is != null) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", resourceName);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    void loadFromFile(final Path configPath) {
        if (Files.exists(configPath)) {
            try (final InputStream is = Files.newInputStream(configPath)) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", configPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", configPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> classifierConfig = (Map<String, Object>) config.get("classifier");
        if (classifierConfig == null) {
            return;
        }

        final Map<String, Object> modelConfig = (Map<String, Object>) classifierConfig.get("model");
        if (modelConfig != null) {
            final Object path = modelConfig.get("path");
            if (path != null) {
                final String resolved = resolveVariables(path.toString());
                this.modelPath = resolved == null || resolved.isBlank() ? null : resolved.trim();
            }
        }

        if (classifierConfig.containsKey("uncertainty-threshold")) {
            this.uncertaintyThreshold = ((Number) classifierConfig.get("uncertainty-threshold")).doubleValue();
        }

        final Map<String, Object> explainConfig = (Map<String, Object>) classifierConfig.get("explain");
        if (explainConfig != null && explainConfig.containsKey("top-features")) {
            this.topFeatures = ((Number) explainConfig.get("top-features")).intValue();
        }

        final Map<String, Object> stemmingConfig = (Map<String, Object>) classifierConfig.get("stemming");
        if (stemmingConfig != null) {
            if (stemmingConfig.containsKey("cache-size")) {
                this.stemCacheSize = ((Number) stemmingConfig.get("cache-size")).longValue();
            }
            if (stemmingConfig.containsKey("trace")) {
                this.traceStemming = (Boolean) stemmingConfig.get("trace");
            }
        }
    }

    void applyOverrides(final @Nullable String envModelPath, final @Nullable String propModelPath) {
        if (propModelPath != null && !propModelPath.isBlank()) {
            this.modelPath = propModelPath.trim();
        }
        if (envModelPath != null && !envModelPath.isBlank()) {
            this.modelPath = envModelPath.trim();
            logger.info("Model path from environment: {}", this.modelPath);
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty(PROP_PROFILE, "default");
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    void validate() {
        if (uncertaintyThreshold < 0.5 || uncertaintyThreshold > 1.0) {
            throw new IllegalStateException("uncertainty-threshold must be between 0.5 and 1.0: " + uncertaintyThreshold);
        }
        if (topFeatures < 0) {
            throw new IllegalStateException("explain.top-features must not be negative: " + topFeatures);
        }
        if (stemCacheSize < 0) {
            throw new IllegalStateException("stemming.cache-size must not be negative: " + stemCacheSize);
        }
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private @Nullable String resolveVariables(final @Nullable String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String[] parts = result.substring(start + 2, end).split(":", 2);
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            String replacement = System.getenv(parts[0]);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(parts[0], defaultValue);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters
    public @Nullable String getModelPath() {
        return modelPath;
    }

    public void setModelPath(final @Nullable String modelPath) {
        this.modelPath = modelPath;
    }

    public double getUncertaintyThreshold() {
        return uncertaintyThreshold;
    }

    public void setUncertaintyThreshold(final double uncertaintyThreshold) {
        this.uncertaintyThreshold = uncertaintyThreshold;
    }

    public int getTopFeatures() {
        return topFeatures;
    }

    public void setTopFeatures(final int topFeatures) {
        this.topFeatures = topFeatures;
    }

    public long getStemCacheSize() {
        return stemCacheSize;
    }

    public void setStemCacheSize(final long stemCacheSize) {
        this.stemCacheSize = stemCacheSize;
    }

    public boolean isTraceStemming() {
        return traceStemming;
    }

    public void setTraceStemming(final boolean traceStemming) {
        this.traceStemming = traceStemming;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
