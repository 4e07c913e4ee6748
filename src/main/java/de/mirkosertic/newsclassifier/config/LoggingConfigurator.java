package de.mirkosertic.newsclassifier.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Configures logging based on the active profile.
 * <p>
 * In deployed mode, when the classifier runs behind another process that consumes its
 * JSON output, logback-deployed.xml routes all log output to a file under
 * ~/.newsclassifier/log.
 * <p>
 * In default mode logback.xml is used, which logs to stderr and keeps stdout free for results.
 */
public final class LoggingConfigurator {

    static final String LOG_DIR_PROPERTY = "newsclassifier.log.dir";
    private static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Configure logging based on the active profile.
     * Must be called before the first logger is used.
     *
     * @param deployedMode true if the output is consumed by another process
     */
    public static void configure(final boolean deployedMode) {
        if (deployedMode) {
            final Path logDir = ApplicationConfig.getConfigDirectory().resolve("log");
            System.setProperty(LOG_DIR_PROPERTY, logDir.toString());
            ensureLogDirectoryExists(logDir);
            loadConfiguration(DEPLOYED_CONFIG);
        }
        // Default mode uses logback.xml which is loaded automatically
    }

    private static void ensureLogDirectoryExists(final Path logDir) {
        try {
            Files.createDirectories(logDir);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory: " + logDir);
        }
    }

    private static void loadConfiguration(final String configFile) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (InputStream configStream = LoggingConfigurator.class.getClassLoader()
                .getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + configFile + " on classpath");
                return;
            }
            context.reset();
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        }
    }
}
