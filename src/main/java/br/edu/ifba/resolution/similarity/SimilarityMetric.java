package br.edu.ifba.resolution.similarity;

import java.util.Locale;

/**
 * String similarity metrics available for per-field scoring.
 * Every metric returns a score in [0.0, 1.0] and is symmetric.
 */
public enum SimilarityMetric {
    
    /**
     * Jaro-Winkler similarity, suited to short strings such as person names.
     */
    JARO_WINKLER("jaro-winkler"),
    
    /**
     * Normalized Levenshtein similarity: 1 - distance / maxLength.
     */
    LEVENSHTEIN("levenshtein"),
    
    /**
     * 1.0 when the values are equal, 0.0 otherwise. For deterministic
     * fields like normalized email or phone.
     */
    EXACT("exact"),
    
    /**
     * Jaccard overlap of whitespace-separated tokens, for addresses.
     */
    TOKEN_JACCARD("token-jaccard");
    
    private final String configName;
    
    SimilarityMetric(String configName) {
        this.configName = configName;
    }
    
    public String configName() {
        return configName;
    }
    
    /**
     * Parses a metric from its configuration name, case-insensitive.
     * Enum constant names ({@code JARO_WINKLER}) are accepted too.
     *
     * @param value the configured name
     * @return the matching metric
     * @throws IllegalArgumentException if value doesn't match any metric
     */
    public static SimilarityMetric fromName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Similarity metric cannot be blank");
        }
        String candidate = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (SimilarityMetric metric : values()) {
            if (metric.configName.equals(candidate)) {
                return metric;
            }
        }
        throw new IllegalArgumentException(
            "Unknown similarity metric: '" + value + "'. Valid values are: " +
            "jaro-winkler, levenshtein, exact, token-jaccard"
        );
    }
}
