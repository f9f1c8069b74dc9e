package br.edu.ifba.resolution.graph;

import br.edu.ifba.resolution.core.FieldType;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Unordered weighted edge between two records.
 * 
 * <p>The pair is stored with the lexicographically smaller id as
 * {@code sourceId}, so {@code (a, b)} and {@code (b, a)} build equal edges.</p>
 *
 * @param sourceId smaller record id
 * @param targetId larger record id
 * @param fieldScores per-field similarity [0.0, 1.0] for fields compared on both sides
 * @param score aggregated similarity [0.0, 1.0]
 */
public record SimilarityEdge(
    String sourceId,
    String targetId,
    Map<FieldType, Double> fieldScores,
    double score
) {
    
    public SimilarityEdge {
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId cannot be null or blank");
        }
        if (targetId == null || targetId.isBlank()) {
            throw new IllegalArgumentException("targetId cannot be null or blank");
        }
        if (sourceId.equals(targetId)) {
            throw new IllegalArgumentException("Self-loop on record '" + sourceId + "' is not allowed");
        }
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be in [0.0, 1.0], got " + score);
        }
        if (sourceId.compareTo(targetId) > 0) {
            String swap = sourceId;
            sourceId = targetId;
            targetId = swap;
        }
        EnumMap<FieldType, Double> copy = new EnumMap<>(FieldType.class);
        copy.putAll(fieldScores);
        fieldScores = Collections.unmodifiableMap(copy);
    }
    
    /**
     * Key identifying the unordered pair.
     */
    public String pairKey() {
        return pairKey(sourceId, targetId);
    }
    
    /**
     * Key identifying the unordered pair of two ids. The smaller id is length
     * prefixed, so any characters may appear in either id.
     */
    public static String pairKey(@NotNull String id1, @NotNull String id2) {
        if (id1.compareTo(id2) > 0) {
            return id2.length() + ":" + id2 + id1;
        }
        return id1.length() + ":" + id1 + id2;
    }
    
    /**
     * The endpoint opposite to {@code id}.
     */
    public String other(@NotNull String id) {
        if (id.equals(sourceId)) {
            return targetId;
        }
        if (id.equals(targetId)) {
            return sourceId;
        }
        throw new IllegalArgumentException("Record '" + id + "' is not an endpoint of " + pairKey());
    }
    
    /**
     * Returns a formatted string representation for logging.
     */
    public String toLogString() {
        StringBuilder fields = new StringBuilder();
        fieldScores.forEach((field, value) -> {
            if (fields.length() > 0) {
                fields.append(' ');
            }
            fields.append(field.key()).append('=').append(String.format("%.2f", value));
        });
        return String.format("Edge('%s' - '%s'): %.3f [%s]", sourceId, targetId, score, fields);
    }
}
