package br.edu.ifba.resolution.cluster;

import br.edu.ifba.resolution.graph.SimilarityEdge;
import br.edu.ifba.resolution.graph.SimilarityGraph;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Undirected weighted graph handed to community detection. Nodes are indexed
 * in ascending id order so that algorithms can work on int indices.
 */
public final class WeightedGraph {
    
    private final List<String> nodeIds;
    private final Map<String, Integer> indexById;
    private final List<TreeMap<Integer, Double>> adjacency;
    private double totalWeight;
    
    private WeightedGraph(List<String> sortedIds) {
        this.nodeIds = List.copyOf(sortedIds);
        this.indexById = new HashMap<>();
        this.adjacency = new ArrayList<>(sortedIds.size());
        for (int i = 0; i < nodeIds.size(); i++) {
            indexById.put(nodeIds.get(i), i);
            adjacency.add(new TreeMap<>());
        }
    }
    
    /**
     * Partition input for a similarity graph: every node, and only the edges
     * whose aggregated score reaches {@code minScore}.
     */
    @NotNull
    public static WeightedGraph from(@NotNull SimilarityGraph graph, double minScore) {
        WeightedGraph weighted = new WeightedGraph(new ArrayList<>(graph.nodeIds()));
        for (SimilarityEdge edge : graph.allEdges()) {
            if (edge.score() >= minScore) {
                weighted.connect(edge.sourceId(), edge.targetId(), edge.score());
            }
        }
        return weighted;
    }
    
    /**
     * Graph over the given ids with no edges yet; used to build inputs by hand.
     */
    @NotNull
    public static WeightedGraph of(@NotNull List<String> ids) {
        List<String> sorted = new ArrayList<>(ids);
        Collections.sort(sorted);
        return new WeightedGraph(sorted);
    }
    
    /**
     * Adds an undirected edge, or replaces its weight.
     */
    public WeightedGraph connect(@NotNull String id1, @NotNull String id2, double weight) {
        Integer i = indexById.get(id1);
        Integer j = indexById.get(id2);
        if (i == null || j == null) {
            throw new IllegalArgumentException("Unknown node in edge " + id1 + " - " + id2);
        }
        if (i.equals(j)) {
            throw new IllegalArgumentException("Self loop on " + id1);
        }
        if (weight <= 0.0) {
            throw new IllegalArgumentException("weight must be positive");
        }
        Double previous = adjacency.get(i).put(j, weight);
        adjacency.get(j).put(i, weight);
        totalWeight += weight - (previous != null ? previous : 0.0);
        return this;
    }
    
    /**
     * Induced subgraph over the given ids: those nodes and the edges among them.
     */
    @NotNull
    public WeightedGraph subgraph(@NotNull Collection<String> ids) {
        WeightedGraph sub = of(new ArrayList<>(ids));
        for (String id : sub.nodeIds) {
            Integer index = indexById.get(id);
            if (index == null) {
                throw new IllegalArgumentException("Unknown node " + id);
            }
            for (Map.Entry<Integer, Double> neighbor : adjacency.get(index).entrySet()) {
                String other = nodeIds.get(neighbor.getKey());
                if (id.compareTo(other) < 0 && sub.indexById.containsKey(other)) {
                    sub.connect(id, other, neighbor.getValue());
                }
            }
        }
        return sub;
    }
    
    public int nodeCount() {
        return nodeIds.size();
    }
    
    public String nodeId(int index) {
        return nodeIds.get(index);
    }
    
    public List<String> nodeIds() {
        return nodeIds;
    }
    
    /**
     * Neighbors of a node by index with edge weights, in index order.
     */
    public Map<Integer, Double> neighbors(int index) {
        return Collections.unmodifiableMap(adjacency.get(index));
    }
    
    /**
     * Sum of edge weights, each edge counted once.
     */
    public double totalWeight() {
        return totalWeight;
    }
    
    public int edgeCount() {
        int degreeSum = 0;
        for (TreeMap<Integer, Double> neighbors : adjacency) {
            degreeSum += neighbors.size();
        }
        return degreeSum / 2;
    }
}
