package br.edu.ifba.resolution.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A record with its typed fields normalized. Fields absent from the raw
 * record are absent here.
 *
 * @param id record identifier
 * @param source the raw record this was derived from
 * @param values normalized values per typed field
 */
public record NormalizedRecord(
    @NotNull String id,
    @NotNull Record source,
    @NotNull Map<FieldType, FieldValue> values
) {
    
    public NormalizedRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        EnumMap<FieldType, FieldValue> copy = new EnumMap<>(FieldType.class);
        copy.putAll(values);
        values = Collections.unmodifiableMap(copy);
    }
    
    @Nullable
    public FieldValue value(@NotNull FieldType type) {
        return values.get(type);
    }
    
    /**
     * Normalized value of a field, or null when absent.
     */
    @Nullable
    public String normalized(@NotNull FieldType type) {
        FieldValue value = values.get(type);
        return value != null ? value.normalized() : null;
    }
    
    /**
     * Normalized value of a field when it can take part in blocking and scoring.
     */
    @Nullable
    public String comparable(@NotNull FieldType type) {
        String normalized = normalized(type);
        return type.isComparable(normalized) ? normalized : null;
    }
}
