package br.edu.ifba.resolution.cluster;

import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Louvain modularity optimization.
 * 
 * <p>Each level moves nodes, visited in a seeded random order, to the
 * neighboring community with the largest modularity gain, then collapses
 * communities into super-nodes. Levels repeat until nothing moves. The
 * resolution parameter γ scales the null-model term: larger values give
 * smaller communities.</p>
 * 
 * <p>Each connected component is optimized on its own, so records only ever
 * share a community with records they are linked to, and unrelated parts of
 * the graph never change a component's partition. At the default γ a chain
 * of pairwise links stays together while dense groups joined by a single
 * edge are split.</p>
 */
@ApplicationScoped
public class LouvainCommunityDetection implements CommunityDetection {
    
    private static final Logger logger = LoggerFactory.getLogger(LouvainCommunityDetection.class);
    
    public static final String NAME = "louvain";
    
    private static final ConnectedComponentsDetection COMPONENTS = new ConnectedComponentsDetection();
    
    /**
     * Default γ. A contiguous chain merges whenever every cut edge outweighs
     * γ·d(A)·d(B)/2m, which holds for linked records of similar strength
     * below about 0.45.
     */
    public static final double DEFAULT_RESOLUTION = 0.3;
    
    private static final double MIN_GAIN = 1e-12;
    private static final int MAX_PASSES_PER_LEVEL = 100;
    private static final int MAX_LEVELS = 50;
    
    @Override
    public String name() {
        return NAME;
    }
    
    @NotNull
    @Override
    public List<SortedSet<String>> partition(@NotNull WeightedGraph graph, long seed) {
        return partition(graph, seed, DEFAULT_RESOLUTION);
    }
    
    @NotNull
    @Override
    public List<SortedSet<String>> partition(@NotNull WeightedGraph graph, long seed, double resolution) {
        if (resolution <= 0.0) {
            throw new IllegalArgumentException("resolution must be positive");
        }
        
        List<SortedSet<String>> communities = new ArrayList<>();
        for (SortedSet<String> component : COMPONENTS.partition(graph, seed)) {
            if (component.size() == 1) {
                communities.add(component);
            } else {
                communities.addAll(partitionComponent(graph.subgraph(component), seed, resolution));
            }
        }
        return communities;
    }
    
    /**
     * Multi-level optimization of one connected component.
     */
    private List<SortedSet<String>> partitionComponent(WeightedGraph graph, long seed, double resolution) {
        int n = graph.nodeCount();
        // membership[i] = community of original node i
        int[] membership = new int[n];
        for (int i = 0; i < n; i++) {
            membership[i] = i;
        }
        
        if (graph.totalWeight() > 0.0) {
            Level level = Level.from(graph);
            Random random = new Random(seed);
            
            for (int depth = 0; depth < MAX_LEVELS; depth++) {
                int[] communities = level.moveNodes(resolution, random);
                int count = renumber(communities);
                if (count == level.size()) {
                    break;
                }
                for (int i = 0; i < n; i++) {
                    membership[i] = communities[membership[i]];
                }
                logger.debug("Louvain level {}: {} -> {} communities", depth, level.size(), count);
                level = level.aggregate(communities, count);
            }
        }
        
        Map<Integer, SortedSet<String>> grouped = new TreeMap<>();
        for (int i = 0; i < n; i++) {
            grouped.computeIfAbsent(membership[i], k -> new TreeSet<>()).add(graph.nodeId(i));
        }
        return new ArrayList<>(grouped.values());
    }
    
    /**
     * Renumbers community labels to 0..k-1 in order of first appearance.
     *
     * @return number of communities
     */
    private static int renumber(int[] communities) {
        Map<Integer, Integer> mapping = new HashMap<>();
        for (int i = 0; i < communities.length; i++) {
            Integer label = mapping.get(communities[i]);
            if (label == null) {
                label = mapping.size();
                mapping.put(communities[i], label);
            }
            communities[i] = label;
        }
        return mapping.size();
    }
    
    /**
     * One level of the hierarchy. {@code selfLoops[i]} holds the weight internal
     * to super-node i, counted so that degree(i) = selfLoops[i] + sum of its edges.
     */
    private static final class Level {
        private final List<TreeMap<Integer, Double>> edges;
        private final double[] selfLoops;
        private final double[] degrees;
        private final double totalDegree;
        
        private Level(List<TreeMap<Integer, Double>> edges, double[] selfLoops) {
            this.edges = edges;
            this.selfLoops = selfLoops;
            this.degrees = new double[edges.size()];
            double sum = 0.0;
            for (int i = 0; i < edges.size(); i++) {
                double degree = selfLoops[i];
                for (double weight : edges.get(i).values()) {
                    degree += weight;
                }
                degrees[i] = degree;
                sum += degree;
            }
            this.totalDegree = sum;
        }
        
        static Level from(WeightedGraph graph) {
            List<TreeMap<Integer, Double>> edges = new ArrayList<>(graph.nodeCount());
            for (int i = 0; i < graph.nodeCount(); i++) {
                edges.add(new TreeMap<>(graph.neighbors(i)));
            }
            return new Level(edges, new double[graph.nodeCount()]);
        }
        
        int size() {
            return edges.size();
        }
        
        int[] moveNodes(double resolution, Random random) {
            int n = size();
            int[] community = new int[n];
            double[] communityDegree = new double[n];
            for (int i = 0; i < n; i++) {
                community[i] = i;
                communityDegree[i] = degrees[i];
            }
            
            List<Integer> order = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                order.add(i);
            }
            Collections.shuffle(order, random);
            
            boolean moved = true;
            for (int pass = 0; pass < MAX_PASSES_PER_LEVEL && moved; pass++) {
                moved = false;
                for (int node : order) {
                    int current = community[node];
                    double degree = degrees[node];
                    
                    // Weights from node to each neighboring community, in community order
                    Map<Integer, Double> links = new TreeMap<>();
                    for (Map.Entry<Integer, Double> edge : edges.get(node).entrySet()) {
                        links.merge(community[edge.getKey()], edge.getValue(), Double::sum);
                    }
                    
                    communityDegree[current] -= degree;
                    
                    int best = current;
                    double bestGain = links.getOrDefault(current, 0.0)
                        - resolution * communityDegree[current] * degree / totalDegree;
                    for (Map.Entry<Integer, Double> link : links.entrySet()) {
                        int candidate = link.getKey();
                        if (candidate == current) {
                            continue;
                        }
                        double gain = link.getValue() - resolution * communityDegree[candidate] * degree / totalDegree;
                        if (gain > bestGain + MIN_GAIN) {
                            best = candidate;
                            bestGain = gain;
                        }
                    }
                    
                    communityDegree[best] += degree;
                    if (best != current) {
                        community[node] = best;
                        moved = true;
                    }
                }
            }
            
            return community;
        }
        
        Level aggregate(int[] communities, int count) {
            List<TreeMap<Integer, Double>> aggregated = new ArrayList<>(count);
            for (int c = 0; c < count; c++) {
                aggregated.add(new TreeMap<>());
            }
            double[] internal = new double[count];
            
            for (int i = 0; i < size(); i++) {
                int ci = communities[i];
                internal[ci] += selfLoops[i];
                for (Map.Entry<Integer, Double> edge : edges.get(i).entrySet()) {
                    int cj = communities[edge.getKey()];
                    if (ci == cj) {
                        // Visited from both endpoints, so each internal edge adds twice
                        internal[ci] += edge.getValue();
                    } else {
                        aggregated.get(ci).merge(cj, edge.getValue(), Double::sum);
                    }
                }
            }
            
            return new Level(aggregated, internal);
        }
    }
}
