package br.edu.ifba.resolution.storage;

import br.edu.ifba.resolution.core.FieldType;
import br.edu.ifba.resolution.graph.SimilarityEdge;
import br.edu.ifba.resolution.merge.MasterEntity;
import br.edu.ifba.resolution.merge.Resolution;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;

/**
 * Receives the outputs of a run. Called synchronously from the engine thread,
 * in pipeline order: normalized values, edges, clusters, masters, assignments,
 * resolution.
 * 
 * Implementations: InMemoryResolutionStore
 */
public interface ResolutionSink {
    
    /**
     * Write-back of one normalized field value. Only called when
     * {@code resolution.normalization.persist} is enabled.
     */
    void writeNormalized(@NotNull String recordId, @NotNull FieldType field, @NotNull String normalizedValue);
    
    /**
     * All similarity edges of the run, in deterministic order.
     */
    void writeEdges(@NotNull List<SimilarityEdge> edges);
    
    /**
     * Record id to cluster id for every clustered record.
     */
    void writeClusters(@NotNull Map<String, Integer> clusterAssignments);
    
    void writeMasterEntities(@NotNull List<MasterEntity> masters);
    
    /**
     * Record id to master entity id for every clustered record.
     */
    void writeAssignments(@NotNull Map<String, String> masterAssignments);
    
    /**
     * Merged records or same-as links, depending on the run mode.
     */
    void writeResolution(@NotNull Resolution resolution);
}
