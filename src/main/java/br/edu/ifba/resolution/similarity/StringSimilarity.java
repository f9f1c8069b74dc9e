package br.edu.ifba.resolution.similarity;

import java.util.HashSet;
import java.util.Set;

/**
 * String similarity functions over normalized values.
 * 
 * <p>All functions return a score in [0.0, 1.0] and are symmetric: arguments
 * are put in a canonical order before comparison, so the result never depends
 * on which record came first.</p>
 */
public final class StringSimilarity {
    
    private static final double WINKLER_SCALING = 0.1;
    private static final int WINKLER_MAX_PREFIX = 4;
    
    private StringSimilarity() {
    }
    
    /**
     * Computes the score of a metric for two normalized values.
     *
     * @param metric the metric
     * @param value1 first value (must not be null)
     * @param value2 second value (must not be null)
     * @return similarity [0.0, 1.0]
     */
    public static double compute(SimilarityMetric metric, String value1, String value2) {
        if (value1 == null || value2 == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        
        // Canonical order keeps every metric symmetric
        String a = value1.compareTo(value2) <= 0 ? value1 : value2;
        String b = a == value1 ? value2 : value1;
        
        switch (metric) {
            case JARO_WINKLER:
                return jaroWinkler(a, b);
            case LEVENSHTEIN:
                return levenshteinSimilarity(a, b);
            case EXACT:
                return a.equals(b) ? 1.0 : 0.0;
            case TOKEN_JACCARD:
                return tokenJaccard(a, b);
            default:
                throw new IllegalArgumentException("Unsupported metric: " + metric);
        }
    }
    
    /**
     * Jaro-Winkler similarity with the standard 0.1 prefix scale over at most 4 characters.
     */
    public static double jaroWinkler(String s1, String s2) {
        double jaro = jaro(s1, s2);
        if (jaro == 0.0) {
            return 0.0;
        }
        
        int prefix = 0;
        int limit = Math.min(WINKLER_MAX_PREFIX, Math.min(s1.length(), s2.length()));
        while (prefix < limit && s1.charAt(prefix) == s2.charAt(prefix)) {
            prefix++;
        }
        
        return jaro + prefix * WINKLER_SCALING * (1.0 - jaro);
    }
    
    /**
     * Jaro similarity: matching characters within a sliding window, penalized
     * by half the number of transpositions.
     */
    public static double jaro(String s1, String s2) {
        if (s1.equals(s2)) {
            return s1.isEmpty() ? 0.0 : 1.0;
        }
        
        int len1 = s1.length();
        int len2 = s2.length();
        if (len1 == 0 || len2 == 0) {
            return 0.0;
        }
        
        int window = Math.max(0, Math.max(len1, len2) / 2 - 1);
        boolean[] matched1 = new boolean[len1];
        boolean[] matched2 = new boolean[len2];
        
        int matches = 0;
        for (int i = 0; i < len1; i++) {
            int start = Math.max(0, i - window);
            int end = Math.min(len2, i + window + 1);
            for (int j = start; j < end; j++) {
                if (!matched2[j] && s1.charAt(i) == s2.charAt(j)) {
                    matched1[i] = true;
                    matched2[j] = true;
                    matches++;
                    break;
                }
            }
        }
        
        if (matches == 0) {
            return 0.0;
        }
        
        int transpositions = 0;
        int k = 0;
        for (int i = 0; i < len1; i++) {
            if (matched1[i]) {
                while (!matched2[k]) {
                    k++;
                }
                if (s1.charAt(i) != s2.charAt(k)) {
                    transpositions++;
                }
                k++;
            }
        }
        
        double m = matches;
        return (m / len1 + m / len2 + (m - transpositions / 2.0) / m) / 3.0;
    }
    
    /**
     * Normalized Levenshtein similarity.
     * 
     * Formula: 1 - (editDistance / maxLength)
     */
    public static double levenshteinSimilarity(String s1, String s2) {
        if (s1.equals(s2)) {
            return s1.isEmpty() ? 0.0 : 1.0;
        }
        
        int maxLength = Math.max(s1.length(), s2.length());
        int distance = levenshteinDistance(s1, s2);
        return 1.0 - ((double) distance / maxLength);
    }
    
    /**
     * Computes the Levenshtein distance between two strings.
     */
    static int levenshteinDistance(String s1, String s2) {
        int len1 = s1.length();
        int len2 = s2.length();
        
        if (len1 == 0) return len2;
        if (len2 == 0) return len1;
        
        int[] previous = new int[len2 + 1];
        int[] current = new int[len2 + 1];
        for (int j = 0; j <= len2; j++) {
            previous[j] = j;
        }
        
        for (int i = 1; i <= len1; i++) {
            current[0] = i;
            for (int j = 1; j <= len2; j++) {
                int cost = (s1.charAt(i - 1) == s2.charAt(j - 1)) ? 0 : 1;
                current[j] = Math.min(
                    Math.min(previous[j] + 1, current[j - 1] + 1),
                    previous[j - 1] + cost
                );
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        
        return previous[len2];
    }
    
    /**
     * Jaccard similarity (token overlap).
     * 
     * Formula: |intersection| / |union| of whitespace-separated token sets
     */
    public static double tokenJaccard(String s1, String s2) {
        Set<String> tokens1 = tokenize(s1);
        Set<String> tokens2 = tokenize(s2);
        
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }
        
        Set<String> intersection = new HashSet<>(tokens1);
        intersection.retainAll(tokens2);
        
        Set<String> union = new HashSet<>(tokens1);
        union.addAll(tokens2);
        
        return (double) intersection.size() / union.size();
    }
    
    private static Set<String> tokenize(String value) {
        Set<String> result = new HashSet<>();
        for (String token : value.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                result.add(token);
            }
        }
        return result;
    }
}
