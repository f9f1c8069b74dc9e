package br.edu.ifba.resolution.export;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.OutputStream;

/**
 * JSON exporter for the resolution graph.
 * 
 * <h2>Output Format:</h2>
 * <pre>
 * {
 *   "nodes": [
 *     {"id": "r1", "label": "Record", "displayName": "John Smith", "properties": {"cluster_id": "1", ...}}
 *   ],
 *   "edges": [
 *     {"sourceId": "r1", "targetId": "r2", "type": "SIMILAR_TO", "score": 0.97, "fieldScores": {"name": 0.95}}
 *   ]
 * }
 * </pre>
 */
@ApplicationScoped
public class JsonGraphExporter implements GraphExporter {
    
    private final ObjectMapper mapper;
    
    public JsonGraphExporter() {
        this.mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }
    
    @Override
    public void export(
            @NotNull GraphSnapshot snapshot,
            @NotNull ExportConfig config,
            @NotNull OutputStream outputStream) throws IOException {
        mapper.writeValue(outputStream, snapshot);
        outputStream.flush();
    }
    
    @Override
    public ExportConfig.ExportFormat getFormat() {
        return ExportConfig.ExportFormat.JSON;
    }
}
