package de.mirkosertic.newsclassifier.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build time of the classifier, read from the Maven-filtered build-info.properties.
 * Falls back to "dev"/"unknown" when the resource is missing or not filtered.
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";

    private static final String version;
    private static final String buildTimestamp;

    static {
        final Properties props = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input != null) {
                props.load(input);
            } else {
                logger.debug("{} not found, running from IDE or unpackaged classes", BUILD_INFO_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load build info, using defaults", e);
        }
        version = filteredOrDefault(props.getProperty("build.version"), "dev");
        buildTimestamp = filteredOrDefault(props.getProperty("build.timestamp"), "unknown");
    }

    private BuildInfo() {
    }

    private static String filteredOrDefault(final String value, final String fallback) {
        // Unfiltered resources still contain the ${...} placeholder
        if (value == null || value.isBlank() || value.startsWith("${")) {
            return fallback;
        }
        return value;
    }

    public static String getVersion() {
        return version;
    }

    public static String getBuildTimestamp() {
        return buildTimestamp;
    }
}
