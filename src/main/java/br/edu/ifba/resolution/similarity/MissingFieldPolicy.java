package br.edu.ifba.resolution.similarity;

import java.util.Locale;

/**
 * How the weighted average treats a field that is missing, or not
 * comparable, on either side of a pair.
 */
public enum MissingFieldPolicy {
    
    /**
     * Leave the field out and renormalize the remaining weights.
     * Absent evidence is not counted as disagreement.
     */
    IGNORE,
    
    /**
     * Score the field 0.0 with its full weight.
     */
    PENALIZE;
    
    public static MissingFieldPolicy fromString(String value) {
        if (value == null || value.isBlank()) {
            return IGNORE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Invalid missing-field policy: '" + value + "'. Valid values are: IGNORE, PENALIZE"
            );
        }
    }
}
