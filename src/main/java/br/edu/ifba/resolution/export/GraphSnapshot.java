package br.edu.ifba.resolution.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exportable view of a run: record and master nodes with the edges between them.
 *
 * @param nodes nodes, records first then masters, each in id order
 * @param edges edges in type then pair order
 */
public record GraphSnapshot(@NotNull List<Node> nodes, @NotNull List<Edge> edges) {
    
    public GraphSnapshot {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }
    
    public enum NodeLabel {
        RECORD("Record"),
        MASTER_ENTITY("MasterEntity");
        
        private final String label;
        
        NodeLabel(String label) {
            this.label = label;
        }
        
        @JsonValue
        public String label() {
            return label;
        }
    }
    
    public enum EdgeType {
        SIMILAR_TO,
        SAME_AS,
        ASSIGNED_TO
    }
    
    /**
     * @param id record id or master id
     * @param label node kind
     * @param displayName human-readable name
     * @param properties raw fields plus cluster and master ids
     */
    public record Node(
        @NotNull String id,
        @NotNull NodeLabel label,
        @NotNull String displayName,
        @NotNull Map<String, String> properties
    ) {
        public Node {
            properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        }
    }
    
    /**
     * @param sourceId source node id
     * @param targetId target node id
     * @param type relation kind
     * @param score aggregated score, SIMILAR_TO only
     * @param fieldScores per-field scores keyed by field key, SIMILAR_TO only
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Edge(
        @NotNull String sourceId,
        @NotNull String targetId,
        @NotNull EdgeType type,
        @Nullable Double score,
        @Nullable Map<String, Double> fieldScores
    ) {
        public Edge {
            if (fieldScores != null) {
                fieldScores = Collections.unmodifiableMap(new LinkedHashMap<>(fieldScores));
            }
        }
        
        public static Edge of(String sourceId, String targetId, EdgeType type) {
            return new Edge(sourceId, targetId, type, null, null);
        }
    }
}
