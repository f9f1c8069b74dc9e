package br.edu.ifba.resolution.export;

import br.edu.ifba.resolution.core.FieldType;
import br.edu.ifba.resolution.core.NormalizedRecord;
import br.edu.ifba.resolution.core.ResolutionResult;
import br.edu.ifba.resolution.graph.SimilarityEdge;
import br.edu.ifba.resolution.merge.MasterEntity;
import br.edu.ifba.resolution.merge.SameAsLink;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the exportable graph of a run.
 * 
 * <p>{@code maxItems} caps nodes and edges separately. Edges whose endpoints
 * were cut are dropped before the edge cap applies.</p>
 */
@ApplicationScoped
public class GraphSnapshotBuilder {
    
    public static final String CLUSTER_ID = "cluster_id";
    public static final String MASTER_ID = "master_id";
    public static final String MEMBER_COUNT = "member_count";
    
    @NotNull
    public GraphSnapshot build(@NotNull ResolutionResult result, @NotNull ExportConfig config) {
        Map<String, Integer> clusters = result.clustering().assignments();
        Map<String, String> masters = result.assignments();
        
        List<GraphSnapshot.Node> nodes = new ArrayList<>();
        for (NormalizedRecord record : result.normalizedRecords()) {
            Map<String, String> properties = new LinkedHashMap<>(record.source().fields());
            Integer clusterId = clusters.get(record.id());
            if (clusterId != null) {
                properties.put(CLUSTER_ID, String.valueOf(clusterId));
            }
            String masterId = masters.get(record.id());
            if (masterId != null) {
                properties.put(MASTER_ID, masterId);
            }
            String display = record.source().fields().get(config.displayField());
            nodes.add(new GraphSnapshot.Node(
                record.id(), GraphSnapshot.NodeLabel.RECORD, display != null ? display : record.id(), properties
            ));
        }
        
        if (config.includeMasters()) {
            for (MasterEntity master : result.masters()) {
                Map<String, String> properties = new LinkedHashMap<>(master.toRecord().fields());
                properties.put(CLUSTER_ID, String.valueOf(master.clusterId()));
                properties.put(MEMBER_COUNT, String.valueOf(master.memberIds().size()));
                String display = properties.get(config.displayField());
                nodes.add(new GraphSnapshot.Node(
                    master.id(), GraphSnapshot.NodeLabel.MASTER_ENTITY, display != null ? display : master.id(), properties
                ));
            }
        }
        
        if (nodes.size() > config.limit()) {
            nodes = new ArrayList<>(nodes.subList(0, config.limit()));
        }
        Set<String> exported = new HashSet<>();
        nodes.forEach(node -> exported.add(node.id()));
        
        List<GraphSnapshot.Edge> edges = new ArrayList<>();
        if (config.includeSimilarityEdges()) {
            for (SimilarityEdge edge : result.edges()) {
                Map<String, Double> fieldScores = new LinkedHashMap<>();
                for (Map.Entry<FieldType, Double> score : edge.fieldScores().entrySet()) {
                    fieldScores.put(score.getKey().key(), score.getValue());
                }
                addIfExported(edges, exported, new GraphSnapshot.Edge(
                    edge.sourceId(), edge.targetId(), GraphSnapshot.EdgeType.SIMILAR_TO, edge.score(), fieldScores
                ));
            }
        }
        for (SameAsLink link : result.links()) {
            addIfExported(edges, exported,
                GraphSnapshot.Edge.of(link.recordId1(), link.recordId2(), GraphSnapshot.EdgeType.SAME_AS));
        }
        if (config.includeMasters()) {
            for (Map.Entry<String, String> assignment : masters.entrySet()) {
                addIfExported(edges, exported,
                    GraphSnapshot.Edge.of(assignment.getKey(), assignment.getValue(), GraphSnapshot.EdgeType.ASSIGNED_TO));
            }
        }
        
        if (edges.size() > config.limit()) {
            edges = new ArrayList<>(edges.subList(0, config.limit()));
        }
        
        return new GraphSnapshot(nodes, edges);
    }
    
    private static void addIfExported(List<GraphSnapshot.Edge> edges, Set<String> exported, GraphSnapshot.Edge edge) {
        if (exported.contains(edge.sourceId()) && exported.contains(edge.targetId())) {
            edges.add(edge);
        }
    }
}
