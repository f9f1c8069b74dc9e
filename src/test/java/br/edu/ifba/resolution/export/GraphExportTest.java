package br.edu.ifba.resolution.export;

import br.edu.ifba.resolution.ResolutionFixtures;
import br.edu.ifba.resolution.core.Record;
import br.edu.ifba.resolution.core.ResolutionResult;
import br.edu.ifba.resolution.merge.MasterEntity;
import br.edu.ifba.resolution.merge.ResolutionMode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the graph snapshot and its JSON and CSV exporters.
 */
class GraphExportTest {
    
    private static ResolutionResult result;
    private static MasterEntity master;
    
    private final GraphSnapshotBuilder snapshotBuilder = new GraphSnapshotBuilder();
    private final GraphExporterFactory factory = new GraphExporterFactory(
        List.<GraphExporter>of(new JsonGraphExporter(), new CsvGraphExporter())
    );
    private final GraphExportService service = new GraphExportService(snapshotBuilder, factory);
    
    @BeforeAll
    static void resolve() {
        List<Record> records = new ArrayList<>(ResolutionFixtures.scenarioA());
        records.addAll(ResolutionFixtures.scenarioB());
        result = ResolutionFixtures.engine().resolve(records, ResolutionFixtures.settings());
        master = result.masters().get(0);
    }
    
    private static long count(GraphSnapshot snapshot, GraphSnapshot.EdgeType type) {
        return snapshot.edges().stream().filter(e -> e.type() == type).count();
    }
    
    @Nested
    @DisplayName("Snapshot")
    class Snapshot {
        
        @Test
        @DisplayName("should hold records, masters and both edge kinds")
        void shouldBuildFullSnapshot() {
            GraphSnapshot snapshot = snapshotBuilder.build(result, ExportConfig.defaultFor(ExportConfig.ExportFormat.JSON));
            
            assertEquals(8, snapshot.nodes().size());
            assertEquals(GraphSnapshot.NodeLabel.MASTER_ENTITY, snapshot.nodes().get(7).label());
            assertEquals("John Smith", snapshot.nodes().get(7).displayName());
            assertEquals(10, count(snapshot, GraphSnapshot.EdgeType.SIMILAR_TO));
            assertEquals(5, count(snapshot, GraphSnapshot.EdgeType.ASSIGNED_TO));
            assertEquals(0, count(snapshot, GraphSnapshot.EdgeType.SAME_AS));
        }
        
        @Test
        @DisplayName("record nodes should carry cluster and master ids")
        void shouldAnnotateRecords() {
            GraphSnapshot snapshot = snapshotBuilder.build(result, ExportConfig.defaultFor(ExportConfig.ExportFormat.JSON));
            
            GraphSnapshot.Node a1 = snapshot.nodes().get(0);
            GraphSnapshot.Node b1 = snapshot.nodes().get(5);
            assertEquals("a1", a1.id());
            assertEquals("1", a1.properties().get(GraphSnapshotBuilder.CLUSTER_ID));
            assertEquals(master.id(), a1.properties().get(GraphSnapshotBuilder.MASTER_ID));
            assertEquals("Maria Garcia", b1.displayName());
            assertNull(b1.properties().get(GraphSnapshotBuilder.CLUSTER_ID));
        }
        
        @Test
        @DisplayName("should leave out masters and similarity edges on request")
        void shouldHonorIncludeFlags() {
            ExportConfig config = ExportConfig.builder()
                .includeMasters(false)
                .includeSimilarityEdges(false)
                .build();
            
            GraphSnapshot snapshot = snapshotBuilder.build(result, config);
            
            assertEquals(7, snapshot.nodes().size());
            assertTrue(snapshot.edges().isEmpty());
        }
        
        @Test
        @DisplayName("link runs should export same-as edges")
        void shouldExportLinks() {
            ResolutionResult linked = ResolutionFixtures.engine().resolve(
                ResolutionFixtures.scenarioA(), ResolutionFixtures.settings().withMode(ResolutionMode.LINK)
            );
            
            GraphSnapshot snapshot = snapshotBuilder.build(linked, ExportConfig.defaultFor(ExportConfig.ExportFormat.CSV));
            
            assertEquals(10, count(snapshot, GraphSnapshot.EdgeType.SAME_AS));
        }
        
        @Test
        @DisplayName("maxItems should cap nodes and drop edges to cut nodes")
        void shouldCapItems() {
            ExportConfig config = ExportConfig.builder().maxItems(3).build();
            
            GraphSnapshot snapshot = snapshotBuilder.build(result, config);
            
            assertEquals(3, snapshot.nodes().size());
            assertEquals(3, snapshot.edges().size());
            assertTrue(snapshot.edges().stream()
                .allMatch(e -> e.type() == GraphSnapshot.EdgeType.SIMILAR_TO));
        }
    }
    
    @Nested
    @DisplayName("JSON export")
    class JsonExport {
        
        @Test
        @DisplayName("should write nodes and edges as one document")
        void shouldWriteJson() throws Exception {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            
            service.export(result, ExportConfig.defaultFor(ExportConfig.ExportFormat.JSON), out);
            
            JsonNode root = new ObjectMapper().readTree(out.toByteArray());
            assertEquals(8, root.get("nodes").size());
            assertEquals("Record", root.get("nodes").get(0).get("label").asText());
            assertEquals("MasterEntity", root.get("nodes").get(7).get("label").asText());
            
            JsonNode firstEdge = root.get("edges").get(0);
            assertEquals("SIMILAR_TO", firstEdge.get("type").asText());
            assertTrue(firstEdge.get("fieldScores").has("name"));
            
            JsonNode lastEdge = root.get("edges").get(root.get("edges").size() - 1);
            assertEquals("ASSIGNED_TO", lastEdge.get("type").asText());
            assertFalse(lastEdge.has("score"));
        }
    }
    
    @Nested
    @DisplayName("CSV export")
    class CsvExport {
        
        @Test
        @DisplayName("should write a nodes section and an edges section")
        void shouldWriteCsv() throws Exception {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            
            service.export(result, ExportConfig.builder().format("csv").build(), out);
            
            String[] lines = out.toString(StandardCharsets.UTF_8).split("\\R");
            assertEquals("# NODES", lines[0]);
            assertEquals("id,label,display_name,cluster_id,master_id", lines[1]);
            assertEquals("a1,Record,John Smith,1," + master.id(), lines[2]);
            assertEquals(master.id() + ",MasterEntity,John Smith,1," + master.id(), lines[9]);
            assertEquals("", lines[10]);
            assertEquals("# EDGES", lines[11]);
            assertEquals("source,target,type,score", lines[12]);
            assertTrue(lines[13].matches("a1,a2,SIMILAR_TO,0\\.\\d{4}|a1,a2,SIMILAR_TO,1\\.0000"));
            assertEquals("a1," + master.id() + ",ASSIGNED_TO,", lines[lines.length - 5]);
        }
        
        @Test
        @DisplayName("should quote values with separators")
        void shouldEscape() {
            assertEquals("\"Smith, John\"", CsvGraphExporter.escapeCsv("Smith, John"));
            assertEquals("\"say \"\"hi\"\"\"", CsvGraphExporter.escapeCsv("say \"hi\""));
            assertEquals("", CsvGraphExporter.escapeCsv(null));
            assertEquals("plain", CsvGraphExporter.escapeCsv("plain"));
        }
    }
    
    @Nested
    @DisplayName("Exporter factory")
    class Factory {
        
        @Test
        @DisplayName("should resolve exporters by format")
        void shouldResolveByFormat() {
            assertInstanceOf(CsvGraphExporter.class, factory.getExporter(ExportConfig.ExportFormat.CSV));
            assertEquals("application/json", factory.getExporter(ExportConfig.ExportFormat.JSON).getMimeType());
            assertEquals("csv", factory.getExporter(ExportConfig.ExportFormat.CSV).getFileExtension());
        }
        
        @Test
        @DisplayName("should reject formats without an exporter")
        void shouldRejectMissingFormat() {
            GraphExporterFactory jsonOnly = new GraphExporterFactory(List.<GraphExporter>of(new JsonGraphExporter()));
            
            assertFalse(jsonOnly.hasExporter(ExportConfig.ExportFormat.CSV));
            assertThrows(IllegalArgumentException.class, () -> jsonOnly.getExporter(ExportConfig.ExportFormat.CSV));
            assertThrows(IllegalArgumentException.class, () -> ExportConfig.ExportFormat.fromString("xml"));
            assertEquals(ExportConfig.ExportFormat.JSON, ExportConfig.ExportFormat.fromString(" "));
        }
    }
}
