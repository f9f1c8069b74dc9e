package br.edu.ifba.resolution.merge;

import br.edu.ifba.resolution.core.FieldType;
import br.edu.ifba.resolution.core.FieldValue;
import br.edu.ifba.resolution.core.Record;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical representation of one cluster.
 * 
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * MasterEntity master = builder.build(cluster, recordsById);
 * master.normalized(FieldType.NAME);   // "john smith"
 * master.toRecord().fields();          // {full_name=John Smith, email=...}
 * }</pre>
 *
 * @param id deterministic id derived from the member ids
 * @param clusterId id of the cluster this master represents
 * @param memberIds member record ids, ascending
 * @param attributes canonical value per field; fields no member carries are absent
 */
public record MasterEntity(
    @NotNull String id,
    int clusterId,
    @NotNull List<String> memberIds,
    @NotNull Map<FieldType, FieldValue> attributes
) {
    
    public MasterEntity {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        memberIds = List.copyOf(memberIds);
        EnumMap<FieldType, FieldValue> copy = new EnumMap<>(FieldType.class);
        copy.putAll(attributes);
        attributes = Collections.unmodifiableMap(copy);
    }
    
    @Nullable
    public String normalized(@NotNull FieldType type) {
        FieldValue value = attributes.get(type);
        return value != null ? value.normalized() : null;
    }
    
    @Nullable
    public String original(@NotNull FieldType type) {
        FieldValue value = attributes.get(type);
        return value != null ? value.original() : null;
    }
    
    /**
     * The merged record: master id plus canonical original values under each
     * field's primary source key.
     */
    @NotNull
    public Record toRecord() {
        Map<String, String> fields = new LinkedHashMap<>();
        attributes.forEach((type, value) -> fields.put(type.sourceKeys().get(0), value.original()));
        return Record.of(id, fields);
    }
}
