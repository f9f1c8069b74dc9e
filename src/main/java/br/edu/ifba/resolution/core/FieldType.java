package br.edu.ifba.resolution.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Locale;

/**
 * Typed schema of the fields the engine understands.
 * 
 * <p>Each type lists the raw field keys it is read from, in priority order.
 * Raw fields that map to no type are carried through untouched.</p>
 * 
 * <p>Adding a field: declare a constant with its source keys, then give it a
 * normalization rule in {@link RecordNormalizer} and a comparability rule in
 * {@link #isComparable(String)}. Blocking rules, scoring and master-entity
 * synthesis pick it up by name.</p>
 */
public enum FieldType {
    
    NAME("name", List.of("full_name", "name")),
    EMAIL("email", List.of("email")),
    PHONE("phone", List.of("phone", "phone_number")),
    ADDRESS("address", List.of("address")),
    POSTAL_CODE("postal_code", List.of("postal_code", "zip"));
    
    private final String key;
    private final List<String> sourceKeys;
    
    FieldType(String key, List<String> sourceKeys) {
        this.key = key;
        this.sourceKeys = sourceKeys;
    }
    
    /**
     * Configuration key of this field (e.g. {@code postal_code}).
     */
    public String key() {
        return key;
    }
    
    /**
     * Raw record keys this field is read from, first match wins.
     */
    public List<String> sourceKeys() {
        return sourceKeys;
    }
    
    /**
     * Whether a normalized value has the shape required to compare it.
     * Unparseable values survive normalization but take no part in
     * blocking or scoring.
     */
    public boolean isComparable(@Nullable String normalized) {
        if (normalized == null || normalized.isBlank()) {
            return false;
        }
        switch (this) {
            case PHONE:
                return normalized.chars().allMatch(Character::isDigit);
            case EMAIL:
                return normalized.indexOf('@') > 0;
            default:
                return true;
        }
    }
    
    /**
     * Parses a configuration key, case-insensitive, accepting '-' for '_'.
     *
     * @throws IllegalArgumentException if the key names no field
     */
    @NotNull
    public static FieldType fromKey(@NotNull String value) {
        String candidate = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (FieldType type : values()) {
            if (type.key.equals(candidate)) {
                return type;
            }
        }
        throw new IllegalArgumentException(
            "Unknown field: '" + value + "'. Valid values are: name, email, phone, address, postal_code"
        );
    }
}
