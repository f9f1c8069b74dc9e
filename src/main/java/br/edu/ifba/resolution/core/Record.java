package br.edu.ifba.resolution.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An ingested candidate record: a stable identifier plus raw named string fields.
 * 
 * <p>Immutable. The identifier is not validated here so that the engine can
 * reject malformed records individually instead of failing the whole ingest.</p>
 *
 * @param id unique record identifier (may be null or blank on malformed input)
 * @param fields raw field values keyed by source field name
 */
public record Record(@Nullable String id, @NotNull Map<String, String> fields) {
    
    public Record {
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        Map<String, String> copy = new LinkedHashMap<>();
        fields.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        fields = Collections.unmodifiableMap(copy);
    }
    
    public static Record of(@Nullable String id, @NotNull Map<String, String> fields) {
        return new Record(id, fields);
    }
    
    /**
     * Raw value of a typed field, looked up through its source keys.
     *
     * @return the first non-blank value, or null when the record lacks the field
     */
    @Nullable
    public String value(@NotNull FieldType type) {
        for (String key : type.sourceKeys()) {
            String value = fields.get(key);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
