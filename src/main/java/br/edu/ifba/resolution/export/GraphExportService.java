package br.edu.ifba.resolution.export;

import br.edu.ifba.resolution.core.ResolutionResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Exports the graph of a run in the configured format.
 */
@ApplicationScoped
public class GraphExportService {
    
    private static final Logger logger = LoggerFactory.getLogger(GraphExportService.class);
    
    private final GraphSnapshotBuilder snapshotBuilder;
    private final GraphExporterFactory exporterFactory;
    
    @Inject
    public GraphExportService(GraphSnapshotBuilder snapshotBuilder, GraphExporterFactory exporterFactory) {
        this.snapshotBuilder = snapshotBuilder;
        this.exporterFactory = exporterFactory;
    }
    
    /**
     * Writes the run's graph to a stream. The stream is left open.
     *
     * @return the exported snapshot
     * @throws IOException if writing fails
     */
    @NotNull
    public GraphSnapshot export(
            @NotNull ResolutionResult result,
            @NotNull ExportConfig config,
            @NotNull OutputStream outputStream) throws IOException {
        
        GraphSnapshot snapshot = snapshotBuilder.build(result, config);
        exporterFactory.getExporter(config).export(snapshot, config, outputStream);
        
        logger.info("Exported {} nodes and {} edges as {}",
                   snapshot.nodes().size(), snapshot.edges().size(), config.format());
        return snapshot;
    }
}
