package br.edu.ifba.resolution.storage.impl;

import br.edu.ifba.resolution.core.FieldType;
import br.edu.ifba.resolution.graph.SimilarityEdge;
import br.edu.ifba.resolution.merge.MasterEntity;
import br.edu.ifba.resolution.merge.Resolution;
import br.edu.ifba.resolution.storage.ResolutionSink;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory sink keeping the latest run's outputs. Each write replaces the
 * previous content of its kind, so a re-run starts from a clean state.
 */
public class InMemoryResolutionStore implements ResolutionSink {
    
    private static final Logger logger = LoggerFactory.getLogger(InMemoryResolutionStore.class);
    
    private final Map<String, Map<FieldType, String>> normalized = new ConcurrentHashMap<>();
    private volatile List<SimilarityEdge> edges = List.of();
    private volatile Map<String, Integer> clusters = Map.of();
    private volatile List<MasterEntity> masters = List.of();
    private volatile Map<String, String> assignments = Map.of();
    private volatile Resolution resolution;
    
    @Override
    public void writeNormalized(@NotNull String recordId, @NotNull FieldType field, @NotNull String normalizedValue) {
        normalized.computeIfAbsent(recordId, id -> Collections.synchronizedMap(new EnumMap<>(FieldType.class)))
            .put(field, normalizedValue);
    }
    
    @Override
    public void writeEdges(@NotNull List<SimilarityEdge> edges) {
        this.edges = List.copyOf(edges);
        logger.debug("Stored {} edges", edges.size());
    }
    
    @Override
    public void writeClusters(@NotNull Map<String, Integer> clusterAssignments) {
        this.clusters = Collections.unmodifiableMap(new TreeMap<>(clusterAssignments));
    }
    
    @Override
    public void writeMasterEntities(@NotNull List<MasterEntity> masters) {
        this.masters = List.copyOf(masters);
        logger.debug("Stored {} master entities", masters.size());
    }
    
    @Override
    public void writeAssignments(@NotNull Map<String, String> masterAssignments) {
        this.assignments = Collections.unmodifiableMap(new TreeMap<>(masterAssignments));
    }
    
    @Override
    public void writeResolution(@NotNull Resolution resolution) {
        this.resolution = resolution;
    }
    
    @Nullable
    public String normalizedValue(@NotNull String recordId, @NotNull FieldType field) {
        Map<FieldType, String> values = normalized.get(recordId);
        return values != null ? values.get(field) : null;
    }
    
    public int normalizedRecordCount() {
        return normalized.size();
    }
    
    public List<SimilarityEdge> getEdges() {
        return edges;
    }
    
    public Map<String, Integer> getClusters() {
        return clusters;
    }
    
    public List<MasterEntity> getMasters() {
        return masters;
    }
    
    public Map<String, String> getAssignments() {
        return assignments;
    }
    
    @Nullable
    public Resolution getResolution() {
        return resolution;
    }
    
    /**
     * Drops everything written so far.
     */
    public void clear() {
        normalized.clear();
        edges = List.of();
        clusters = Map.of();
        masters = List.of();
        assignments = Map.of();
        resolution = null;
    }
}
