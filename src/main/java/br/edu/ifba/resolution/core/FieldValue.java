package br.edu.ifba.resolution.core;

/**
 * A field value in both its raw and normalized form.
 *
 * @param original raw value as ingested
 * @param normalized canonical comparable form
 */
public record FieldValue(String original, String normalized) {
    
    public FieldValue {
        if (original == null) {
            throw new IllegalArgumentException("original cannot be null");
        }
        if (normalized == null) {
            throw new IllegalArgumentException("normalized cannot be null");
        }
    }
}
