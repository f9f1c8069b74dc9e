package br.edu.ifba.resolution.cluster;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Looks up community detection algorithms by configured name.
 * Unknown names fall back to connected components with a warning.
 */
@ApplicationScoped
public class CommunityDetectionRegistry {
    
    private static final Logger logger = LoggerFactory.getLogger(CommunityDetectionRegistry.class);
    
    private final Map<String, CommunityDetection> algorithms = new TreeMap<>();
    
    @Inject
    public CommunityDetectionRegistry(Instance<CommunityDetection> available) {
        this((Iterable<CommunityDetection>) available);
    }
    
    public CommunityDetectionRegistry(Iterable<CommunityDetection> available) {
        for (CommunityDetection detection : available) {
            algorithms.put(detection.name().toLowerCase(Locale.ROOT), detection);
        }
        if (!algorithms.containsKey(ConnectedComponentsDetection.NAME)) {
            algorithms.put(ConnectedComponentsDetection.NAME, new ConnectedComponentsDetection());
        }
    }
    
    /**
     * Resolves an algorithm by name.
     *
     * @param name configured algorithm name
     * @return the algorithm, or connected components when the name is unknown
     */
    @NotNull
    public CommunityDetection resolve(String name) {
        String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        CommunityDetection detection = algorithms.get(key);
        if (detection == null) {
            logger.warn("Clustering algorithm '{}' is not available (known: {}); falling back to {}",
                       name, algorithms.keySet(), ConnectedComponentsDetection.NAME);
            return algorithms.get(ConnectedComponentsDetection.NAME);
        }
        return detection;
    }
    
    public Set<String> names() {
        return algorithms.keySet();
    }
}
