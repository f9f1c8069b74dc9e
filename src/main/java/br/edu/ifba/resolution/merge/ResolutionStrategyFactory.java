package br.edu.ifba.resolution.merge;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;

import java.util.EnumMap;
import java.util.Map;

/**
 * Factory for selecting the resolution strategy of a run.
 * 
 * <p>Uses CDI to discover all available ResolutionStrategy implementations
 * and provides the one registered for the requested mode.</p>
 * 
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * ResolutionStrategy strategy = factory.getStrategy(settings.mode());
 * Resolution resolution = strategy.resolve(records, clustering, masters);
 * }</pre>
 */
@ApplicationScoped
public class ResolutionStrategyFactory {
    
    private final Map<ResolutionMode, ResolutionStrategy> strategies;
    
    /**
     * Default constructor for CDI proxy.
     */
    public ResolutionStrategyFactory() {
        this.strategies = new EnumMap<>(ResolutionMode.class);
    }
    
    /**
     * Constructs the factory with CDI-discovered strategies.
     * 
     * @param strategyInstances All ResolutionStrategy implementations
     */
    @Inject
    public ResolutionStrategyFactory(Instance<ResolutionStrategy> strategyInstances) {
        this((Iterable<ResolutionStrategy>) strategyInstances);
    }
    
    public ResolutionStrategyFactory(Iterable<ResolutionStrategy> strategyInstances) {
        this.strategies = new EnumMap<>(ResolutionMode.class);
        for (ResolutionStrategy strategy : strategyInstances) {
            strategies.put(strategy.mode(), strategy);
        }
    }
    
    /**
     * Gets the strategy for a mode.
     *
     * @throws IllegalArgumentException if no strategy is registered for the mode
     */
    @NotNull
    public ResolutionStrategy getStrategy(@NotNull ResolutionMode mode) {
        ResolutionStrategy strategy = strategies.get(mode);
        if (strategy == null) {
            throw new IllegalArgumentException(
                    "No strategy registered for mode: " + mode +
                    ". Available modes: " + strategies.keySet());
        }
        return strategy;
    }
}
