package org.lexis.indexing.config;

import org.lexis.indexing.text.NormalizationConfig;

import java.util.HashSet;
import java.util.Properties;
import java.util.Set;

/**
 * Typed configuration for index building.
 *
 * <p>Read from properties the embedding service has already resolved (bundled file plus environment).
 * Some convenience normalization is applied:
 * <ul>
 *   <li>If {@code DOCUMENTS_PATH} is set, it overrides {@code documents.path}.</li>
 *   <li>The stop-word list {@code english} expands to {@link NormalizationConfig#ENGLISH_STOP_WORDS}.</li>
 * </ul>
 * Missing required keys fail fast with {@link IllegalStateException}.</p>
 */
public record IndexingConfig(
    Documents documents,
    int kgramSize,
    NormalizationConfig normalization
) {
    /** Where the document collection lives. */
    public record Documents(String path, String extension) {}

    public static final String ENGLISH_PRESET = "english";

    /**
     * Builds configuration from already-resolved properties.
     */
    public static IndexingConfig from(Properties p) {
        int k = requireInt(p, "index.kgram.size");
        if (k < 1) {
            throw new IllegalStateException("index.kgram.size must be at least 1, got " + k);
        }
        return new IndexingConfig(readDocuments(p), k, readNormalization(p));
    }

    private static Documents readDocuments(Properties p) {
        // a mounted volume given as DOCUMENTS_PATH wins over the bundled path
        String volume = trimToNull(p.getProperty("DOCUMENTS_PATH"));
        String path = volume != null ? volume : requireString(p, "documents.path");
        return new Documents(path, requireString(p, "documents.extension"));
    }

    private static NormalizationConfig readNormalization(Properties p) {
        boolean lowercase = Boolean.parseBoolean(p.getProperty("normalize.lowercase", "true").trim());
        try {
            return new NormalizationConfig(
                lowercase,
                readStopWords(p.getProperty("normalize.stop.words")),
                NormalizationConfig.parseReplacements(p.getProperty("normalize.replacements"))
            );
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid configuration 'normalize.replacements': " + e.getMessage(), e);
        }
    }

    private static Set<String> readStopWords(String value) {
        String trimmed = trimToNull(value);
        if (ENGLISH_PRESET.equalsIgnoreCase(trimmed)) {
            return new HashSet<>(NormalizationConfig.ENGLISH_STOP_WORDS);
        }
        return NormalizationConfig.parseStopWords(trimmed);
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

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
