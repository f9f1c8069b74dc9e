package br.edu.ifba.resolution.cluster;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.SortedSet;

/**
 * Community detection over a weighted graph.
 * 
 * <p>Implementations must return a partition: every node in exactly one
 * community, isolated nodes as communities of size 1. The same graph and
 * seed must always yield the same partition.</p>
 */
public interface CommunityDetection {
    
    /**
     * Name used in {@code resolution.clustering.algorithm}.
     */
    String name();
    
    /**
     * Partitions the graph.
     *
     * @param graph partition input
     * @param seed seed for any randomized step
     * @return communities as sorted id sets
     */
    @NotNull
    List<SortedSet<String>> partition(@NotNull WeightedGraph graph, long seed);
    
    /**
     * Partitions the graph with a modularity resolution. Algorithms without a
     * resolution parameter ignore it.
     */
    @NotNull
    default List<SortedSet<String>> partition(@NotNull WeightedGraph graph, long seed, double resolution) {
        return partition(graph, seed);
    }
}
