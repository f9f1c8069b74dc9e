package br.edu.ifba.resolution.graph;

import br.edu.ifba.resolution.core.NormalizedRecord;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Candidate graph of normalized records and their similarity edges.
 * 
 * <p>Holds at most one edge per unordered pair and no self-loops. A pair
 * reported by several blocks keeps its maximum score. Nodes, neighbors and
 * edges are kept in sorted order so that every traversal is deterministic.</p>
 * 
 * <p>Not thread-safe: a single aggregation step owns all mutation. The graph
 * is sealed before cluster extraction and is read-only from then on.</p>
 */
public class SimilarityGraph {
    
    private final Map<String, NormalizedRecord> nodes = new TreeMap<>();
    private final Map<String, SimilarityEdge> edges = new TreeMap<>();
    private final Map<String, Set<String>> adjacency = new TreeMap<>();
    private boolean sealed = false;
    
    /**
     * Adds a record as a node. Re-adding a record with the same id replaces it.
     */
    public void addNode(@NotNull NormalizedRecord record) {
        ensureMutable();
        nodes.put(record.id(), record);
        adjacency.computeIfAbsent(record.id(), k -> new TreeSet<>());
    }
    
    /**
     * Idempotent upsert: inserts the edge, or keeps whichever of the stored and
     * the given edge has the higher score.
     *
     * @param edge edge between two known nodes
     * @return true if the graph changed
     * @throws IllegalArgumentException if an endpoint is not a node
     * @throws IllegalStateException if the graph is sealed
     */
    public boolean addEdge(@NotNull SimilarityEdge edge) {
        ensureMutable();
        if (!nodes.containsKey(edge.sourceId())) {
            throw new IllegalArgumentException("Unknown record: " + edge.sourceId());
        }
        if (!nodes.containsKey(edge.targetId())) {
            throw new IllegalArgumentException("Unknown record: " + edge.targetId());
        }
        
        String key = edge.pairKey();
        SimilarityEdge existing = edges.get(key);
        if (existing != null && existing.score() >= edge.score()) {
            return false;
        }
        
        edges.put(key, edge);
        adjacency.get(edge.sourceId()).add(edge.targetId());
        adjacency.get(edge.targetId()).add(edge.sourceId());
        return true;
    }
    
    /**
     * Adds every edge of a batch.
     *
     * @return number of edges inserted or raised
     */
    public int addEdges(@NotNull Collection<SimilarityEdge> batch) {
        int changed = 0;
        for (SimilarityEdge edge : batch) {
            if (addEdge(edge)) {
                changed++;
            }
        }
        return changed;
    }
    
    /**
     * Lazily streams the ids adjacent to a record, in sorted order.
     */
    @NotNull
    public Stream<String> neighbors(@NotNull String id) {
        Set<String> adjacent = adjacency.get(id);
        return adjacent != null ? adjacent.stream() : Stream.empty();
    }
    
    /**
     * The edge of an unordered pair, or null if none.
     */
    @Nullable
    public SimilarityEdge edge(@NotNull String id1, @NotNull String id2) {
        return edges.get(SimilarityEdge.pairKey(id1, id2));
    }
    
    /**
     * Every edge, ordered by (sourceId, targetId).
     */
    @NotNull
    public List<SimilarityEdge> allEdges() {
        return Collections.unmodifiableList(new ArrayList<>(edges.values()));
    }
    
    @Nullable
    public NormalizedRecord node(@NotNull String id) {
        return nodes.get(id);
    }
    
    /**
     * Node ids in sorted order.
     */
    @NotNull
    public Set<String> nodeIds() {
        return Collections.unmodifiableSet(nodes.keySet());
    }
    
    public int nodeCount() {
        return nodes.size();
    }
    
    public int edgeCount() {
        return edges.size();
    }
    
    /**
     * Freezes the graph. Further mutation throws {@link IllegalStateException}.
     */
    public void seal() {
        sealed = true;
    }
    
    public boolean isSealed() {
        return sealed;
    }
    
    private void ensureMutable() {
        if (sealed) {
            throw new IllegalStateException("Similarity graph is sealed; it is read-only once clustering starts");
        }
    }
}
