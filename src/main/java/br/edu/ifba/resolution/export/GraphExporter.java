package br.edu.ifba.resolution.export;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Interface for exporting the resolution graph to various formats.
 * 
 * <h2>Contract:</h2>
 * <ul>
 *   <li>MUST write valid format output to the stream</li>
 *   <li>MUST NOT close the output stream (caller responsibility)</li>
 * </ul>
 * 
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * GraphSnapshot snapshot = snapshotBuilder.build(result, config);
 * GraphExporter exporter = factory.getExporter(config);
 * 
 * try (OutputStream os = Files.newOutputStream(target)) {
 *     exporter.export(snapshot, config, os);
 * }
 * }</pre>
 * 
 * @see ExportConfig
 * @see GraphExporterFactory
 */
public interface GraphExporter {
    
    /**
     * Exports a snapshot to the output stream.
     * 
     * @param snapshot nodes and edges to export
     * @param config Export configuration
     * @param outputStream Stream to write the export data
     * @throws IOException If writing fails
     */
    void export(
        @NotNull GraphSnapshot snapshot,
        @NotNull ExportConfig config,
        @NotNull OutputStream outputStream
    ) throws IOException;
    
    /**
     * Gets the MIME type for this exporter's output.
     */
    default String getMimeType() {
        return getFormat().getMimeType();
    }
    
    /**
     * Gets the file extension for this exporter's output, without dot.
     */
    default String getFileExtension() {
        return getFormat().getExtension();
    }
    
    /**
     * Gets the export format this exporter handles.
     */
    ExportConfig.ExportFormat getFormat();
}
