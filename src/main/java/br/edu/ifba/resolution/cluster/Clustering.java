package br.edu.ifba.resolution.cluster;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Outcome of cluster extraction.
 *
 * @param clusters clusters in id order
 * @param singletons ids of records left unclustered, ascending
 * @param algorithm name of the algorithm that produced the partition
 */
public record Clustering(List<Cluster> clusters, List<String> singletons, String algorithm) {
    
    public Clustering {
        clusters = List.copyOf(clusters);
        singletons = List.copyOf(singletons);
    }
    
    /**
     * Record id to cluster id for every clustered record, in record id order.
     */
    public Map<String, Integer> assignments() {
        Map<String, Integer> assignments = new TreeMap<>();
        for (Cluster cluster : clusters) {
            for (String member : cluster.memberIds()) {
                assignments.put(member, cluster.id());
            }
        }
        return Collections.unmodifiableMap(assignments);
    }
    
    public Optional<Cluster> clusterOf(String recordId) {
        return clusters.stream().filter(c -> c.memberIds().contains(recordId)).findFirst();
    }
    
    public int clusteredRecordCount() {
        return clusters.stream().mapToInt(Cluster::size).sum();
    }
}
