package br.edu.ifba.resolution.export;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;

import java.util.EnumMap;
import java.util.Map;

/**
 * Factory for selecting the appropriate GraphExporter based on format.
 * 
 * <p>Uses CDI to discover all available GraphExporter implementations
 * and provides the correct one based on the requested format.</p>
 * 
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * @Inject
 * GraphExporterFactory factory;
 * 
 * GraphExporter exporter = factory.getExporter(ExportFormat.CSV);
 * exporter.export(snapshot, config, outputStream);
 * }</pre>
 */
@ApplicationScoped
public class GraphExporterFactory {
    
    private final Map<ExportConfig.ExportFormat, GraphExporter> exporters;
    
    /**
     * Default constructor for CDI proxy.
     */
    public GraphExporterFactory() {
        this.exporters = new EnumMap<>(ExportConfig.ExportFormat.class);
    }
    
    /**
     * Constructs the factory with CDI-discovered exporters.
     * 
     * @param exporterInstances All GraphExporter implementations
     */
    @Inject
    public GraphExporterFactory(Instance<GraphExporter> exporterInstances) {
        this((Iterable<GraphExporter>) exporterInstances);
    }
    
    public GraphExporterFactory(Iterable<GraphExporter> exporterInstances) {
        this.exporters = new EnumMap<>(ExportConfig.ExportFormat.class);
        
        for (GraphExporter exporter : exporterInstances) {
            exporters.put(exporter.getFormat(), exporter);
        }
    }
    
    /**
     * Gets the exporter for the specified format.
     * 
     * @param format The export format
     * @return GraphExporter implementation
     * @throws IllegalArgumentException if no exporter is registered for the format
     */
    @NotNull
    public GraphExporter getExporter(@NotNull ExportConfig.ExportFormat format) {
        GraphExporter exporter = exporters.get(format);
        
        if (exporter == null) {
            throw new IllegalArgumentException(
                    "No exporter registered for format: " + format + 
                    ". Available formats: " + exporters.keySet());
        }
        
        return exporter;
    }
    
    /**
     * Gets the exporter for the specified config.
     */
    @NotNull
    public GraphExporter getExporter(@NotNull ExportConfig config) {
        return getExporter(config.format());
    }
    
    public boolean hasExporter(@NotNull ExportConfig.ExportFormat format) {
        return exporters.containsKey(format);
    }
}
