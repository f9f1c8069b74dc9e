package br.edu.ifba.resolution.merge;

import java.util.Locale;

/**
 * Run-wide resolution mode. Never mixed within a run, so downstream
 * consumers always see one schema.
 */
public enum ResolutionMode {
    
    /**
     * Replace the members of each cluster with a single merged record.
     * Destructive: the originals are not part of the output.
     */
    MERGE,
    
    /**
     * Keep every original record and add a symmetric same-as relation
     * between each pair inside a cluster. Non-destructive and reversible.
     */
    LINK;
    
    /**
     * Parses a mode, case-insensitive.
     *
     * @throws IllegalArgumentException if value doesn't match any mode
     */
    public static ResolutionMode fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Resolution mode must be set to MERGE or LINK");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Invalid resolution mode: '" + value + "'. Valid values are: MERGE, LINK"
            );
        }
    }
}
