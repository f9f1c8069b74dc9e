package br.edu.ifba.resolution.cluster;

import br.edu.ifba.exception.ClusteringNondeterminismException;
import br.edu.ifba.resolution.core.ResolutionSettings;
import br.edu.ifba.resolution.graph.SimilarityGraph;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;

/**
 * Partitions the sealed similarity graph into clusters.
 * 
 * <p>Only edges at or above the high threshold reach the partitioner; weaker
 * edges stay in the graph for export. Communities of one record are singletons
 * unless singleton promotion is on.</p>
 */
@ApplicationScoped
public class ClusterExtractor {
    
    private static final Logger logger = LoggerFactory.getLogger(ClusterExtractor.class);
    
    private final CommunityDetectionRegistry registry;
    
    @Inject
    public ClusterExtractor(CommunityDetectionRegistry registry) {
        this.registry = registry;
    }
    
    /**
     * Seals the graph and extracts clusters.
     *
     * @param graph similarity graph (sealed by this call)
     * @param settings run settings
     * @return clusters and singletons
     * @throws ClusteringNondeterminismException in verification mode when runs disagree
     */
    @NotNull
    public Clustering extract(@NotNull SimilarityGraph graph, @NotNull ResolutionSettings settings) {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        
        graph.seal();
        
        WeightedGraph input = WeightedGraph.from(graph, settings.highThreshold());
        CommunityDetection detection = registry.resolve(settings.algorithm());
        
        logger.debug("Partitioning {} nodes / {} edges (>= {}) with {}",
                    input.nodeCount(), input.edgeCount(), settings.highThreshold(), detection.name());
        
        List<SortedSet<String>> communities = canonical(
            detection.partition(input, settings.seed(), settings.modularityResolution())
        );
        
        for (int run = 1; run <= settings.verificationRuns(); run++) {
            List<SortedSet<String>> repeated = canonical(
                detection.partition(input, settings.seed(), settings.modularityResolution())
            );
            if (!repeated.equals(communities)) {
                throw new ClusteringNondeterminismException(
                    detection.name(), run,
                    String.format("Verification run %d of %s produced %d communities, first run produced %d",
                                  run, detection.name(), repeated.size(), communities.size())
                );
            }
        }
        if (settings.verificationRuns() > 0) {
            logger.info("Partition verified across {} repeated runs", settings.verificationRuns());
        }
        
        List<Cluster> clusters = new ArrayList<>();
        List<String> singletons = new ArrayList<>();
        for (SortedSet<String> community : communities) {
            if (community.size() > 1 || settings.singletonPromotion()) {
                clusters.add(new Cluster(clusters.size() + 1, new ArrayList<>(community)));
            } else {
                singletons.add(community.first());
            }
        }
        
        logger.debug("Extracted {} clusters and {} singletons", clusters.size(), singletons.size());
        return new Clustering(clusters, singletons, detection.name());
    }
    
    /**
     * Communities ordered by smallest member id, which fixes cluster ids.
     */
    private static List<SortedSet<String>> canonical(List<SortedSet<String>> communities) {
        List<SortedSet<String>> sorted = new ArrayList<>(communities);
        sorted.sort((a, b) -> a.first().compareTo(b.first()));
        return sorted;
    }
}
