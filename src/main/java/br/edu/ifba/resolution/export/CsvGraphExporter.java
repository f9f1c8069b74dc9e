package br.edu.ifba.resolution.export;

import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * CSV exporter for the resolution graph.
 * 
 * <h2>Output Format:</h2>
 * <pre>
 * # NODES
 * id,label,display_name,cluster_id,master_id
 * r1,Record,John Smith,1,5b1e...
 * 
 * # EDGES
 * source,target,type,score
 * r1,r2,SIMILAR_TO,0.9712
 * </pre>
 */
@ApplicationScoped
public class CsvGraphExporter implements GraphExporter {
    
    private static final String NODE_HEADER = "id,label,display_name,cluster_id,master_id";
    private static final String EDGE_HEADER = "source,target,type,score";
    
    @Override
    public void export(
            @NotNull GraphSnapshot snapshot,
            @NotNull ExportConfig config,
            @NotNull OutputStream outputStream) throws IOException {
        
        // Not closed: the caller owns the stream
        BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8));
        
        writeNodes(writer, snapshot);
        if (!snapshot.edges().isEmpty()) {
            writer.newLine();
            writeEdges(writer, snapshot);
        }
        
        writer.flush();
    }
    
    private void writeNodes(BufferedWriter writer, GraphSnapshot snapshot) throws IOException {
        writer.write("# NODES");
        writer.newLine();
        writer.write(NODE_HEADER);
        writer.newLine();
        
        for (GraphSnapshot.Node node : snapshot.nodes()) {
            writer.write(escapeCsv(node.id()));
            writer.write(",");
            writer.write(node.label().label());
            writer.write(",");
            writer.write(escapeCsv(node.displayName()));
            writer.write(",");
            writer.write(escapeCsv(node.properties().get(GraphSnapshotBuilder.CLUSTER_ID)));
            writer.write(",");
            writer.write(escapeCsv(node.label() == GraphSnapshot.NodeLabel.MASTER_ENTITY
                ? node.id()
                : node.properties().get(GraphSnapshotBuilder.MASTER_ID)));
            writer.newLine();
        }
    }
    
    private void writeEdges(BufferedWriter writer, GraphSnapshot snapshot) throws IOException {
        writer.write("# EDGES");
        writer.newLine();
        writer.write(EDGE_HEADER);
        writer.newLine();
        
        for (GraphSnapshot.Edge edge : snapshot.edges()) {
            writer.write(escapeCsv(edge.sourceId()));
            writer.write(",");
            writer.write(escapeCsv(edge.targetId()));
            writer.write(",");
            writer.write(edge.type().name());
            writer.write(",");
            writer.write(edge.score() != null ? String.format(Locale.ROOT, "%.4f", edge.score()) : "");
            writer.newLine();
        }
    }
    
    /**
     * Escapes a string for CSV output.
     * 
     * <p>RFC 4180 compliant: quotes fields containing commas, newlines, or quotes.
     * Doubles any embedded quotes.</p>
     */
    static String escapeCsv(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        
        boolean needsQuoting = value.contains(",") || 
                               value.contains("\"") || 
                               value.contains("\n") ||
                               value.contains("\r");
        
        if (needsQuoting) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        
        return value;
    }
    
    @Override
    public ExportConfig.ExportFormat getFormat() {
        return ExportConfig.ExportFormat.CSV;
    }
}
