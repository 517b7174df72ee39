package org.lexis.search.config;

import org.lexis.indexing.config.IndexingConfig;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Typed configuration for the Search Service.
 *
 * <p>Loads {@code application.properties}, then overlays environment variables. Missing required keys fail
 * fast with {@link IllegalStateException}.</p>
 */
public record SearchConfig(
    int serverPort,
    int maxResults,
    int defaultLimit,
    int defaultProximity,
    double suggestMaxDistance,
    IndexingConfig indexing
) {
    /**
     * Loads configuration from classpath properties plus environment variables.
     *
     * @return a fully-initialized {@link SearchConfig}
     */
    public static SearchConfig load() {
        Properties properties = loadProperties("application.properties");
        overlayEnvironment(properties);
        return from(properties);
    }

    /**
     * Builds configuration from already-resolved properties.
     */
    public static SearchConfig from(Properties p) {
        int maxResults = requireInt(p, "search.max.results");
        int defaultLimit = requireInt(p, "search.default.limit");
        if (defaultLimit > maxResults) {
            throw new IllegalStateException(
                "search.default.limit (" + defaultLimit + ") exceeds search.max.results (" + maxResults + ")");
        }
        return new SearchConfig(
            requireInt(p, "server.port"),
            maxResults,
            defaultLimit,
            requireInt(p, "search.default.proximity"),
            requireDouble(p, "search.suggest.max.distance"),
            IndexingConfig.from(p)
        );
    }

    private static Properties loadProperties(String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = SearchConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resourceName, e);
        }
        return properties;
    }

    private static void overlayEnvironment(Properties properties) {
        properties.putAll(System.getenv());
    }

    private static String requireString(Properties properties, String key) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            throw new IllegalStateException("Missing required configuration: " + key);
        }
        return value;
    }

    private static int requireInt(Properties properties, String key) {
        String value = requireString(properties, key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static double requireDouble(Properties properties, String key) {
        String value = requireString(properties, key);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid number for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
