package br.edu.ifba.resolution.cluster;

import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Connected components of the partition input. Deterministic without a seed;
 * used as the fallback when the configured algorithm is unavailable.
 */
@ApplicationScoped
public class ConnectedComponentsDetection implements CommunityDetection {
    
    public static final String NAME = "connected-components";
    
    @Override
    public String name() {
        return NAME;
    }
    
    @NotNull
    @Override
    public List<SortedSet<String>> partition(@NotNull WeightedGraph graph, long seed) {
        int n = graph.nodeCount();
        boolean[] visited = new boolean[n];
        List<SortedSet<String>> components = new ArrayList<>();
        
        for (int i = 0; i < n; i++) {
            if (!visited[i]) {
                SortedSet<String> component = new TreeSet<>();
                dfs(graph, i, visited, component);
                components.add(component);
            }
        }
        
        return components;
    }
    
    /**
     * Iterative depth-first search; recursion would overflow on long chains.
     */
    private void dfs(WeightedGraph graph, int start, boolean[] visited, SortedSet<String> component) {
        ArrayList<Integer> stack = new ArrayList<>();
        stack.add(start);
        visited[start] = true;
        
        while (!stack.isEmpty()) {
            int node = stack.remove(stack.size() - 1);
            component.add(graph.nodeId(node));
            for (int neighbor : graph.neighbors(node).keySet()) {
                if (!visited[neighbor]) {
                    visited[neighbor] = true;
                    stack.add(neighbor);
                }
            }
        }
    }
}
