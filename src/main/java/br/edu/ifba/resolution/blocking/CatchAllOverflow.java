package br.edu.ifba.resolution.blocking;

import java.util.Locale;

/**
 * What to do when the catch-all block grows past its configured ceiling.
 * A warning is reported in every case.
 */
public enum CatchAllOverflow {
    
    /**
     * Compare a deterministic, seeded sample of max-size records.
     */
    SAMPLE,
    
    /**
     * Skip comparisons in the catch-all block entirely.
     */
    SKIP,
    
    /**
     * Compare every pair anyway.
     */
    PROCEED;
    
    public static CatchAllOverflow fromString(String value) {
        if (value == null || value.isBlank()) {
            return SAMPLE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Invalid catch-all overflow policy: '" + value + "'. Valid values are: SAMPLE, SKIP, PROCEED"
            );
        }
    }
}
