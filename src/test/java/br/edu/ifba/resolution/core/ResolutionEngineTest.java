package br.edu.ifba.resolution.core;

import br.edu.ifba.exception.ConfigurationException;
import br.edu.ifba.resolution.ResolutionFixtures;
import br.edu.ifba.resolution.cluster.Cluster;
import br.edu.ifba.resolution.merge.MasterEntity;
import br.edu.ifba.resolution.merge.ResolutionMode;
import br.edu.ifba.resolution.storage.ResolutionSink;
import br.edu.ifba.resolution.storage.impl.InMemoryRecordSource;
import br.edu.ifba.resolution.storage.impl.InMemoryResolutionStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for ResolutionEngine, wired by hand.
 */
class ResolutionEngineTest {
    
    private final ResolutionEngine engine = ResolutionFixtures.engine();
    
    @Nested
    @DisplayName("Scenario A: spelling variants")
    class SpellingVariants {
        
        @Test
        @DisplayName("should merge all five John Smith records into one master")
        void shouldMergeIntoOneMaster() {
            // Act
            ResolutionResult result = engine.resolve(ResolutionFixtures.scenarioA(), ResolutionFixtures.settings());
            
            // Assert
            assertEquals(10, result.edges().size());
            assertEquals(1, result.clustering().clusters().size());
            assertEquals(List.of("a1", "a2", "a3", "a4", "a5"), result.clustering().clusters().get(0).memberIds());
            assertEquals(1, result.masters().size());
            
            MasterEntity master = result.masters().get(0);
            assertEquals("john smith", master.normalized(FieldType.NAME));
            assertEquals("John Smith", master.original(FieldType.NAME));
            assertEquals(1, result.records().size());
            assertEquals(master.id(), result.records().get(0).id());
            assertEquals(5, result.assignments().size());
        }
        
        @Test
        @DisplayName("link mode should keep the records and add ten links")
        void shouldLinkInsteadOfMerge() {
            ResolutionSettings settings = ResolutionFixtures.settings().withMode(ResolutionMode.LINK);
            
            ResolutionResult result = engine.resolve(ResolutionFixtures.scenarioA(), settings);
            
            assertEquals(ResolutionMode.LINK, result.mode());
            assertEquals(5, result.records().size());
            assertEquals(10, result.links().size());
        }
    }
    
    @Nested
    @DisplayName("Scenario B: same name, nothing else")
    class SameNameOnly {
        
        @Test
        @DisplayName("should not merge records that only share a name")
        void shouldKeepApart() {
            ResolutionResult result = engine.resolve(ResolutionFixtures.scenarioB(), ResolutionFixtures.settings());
            
            assertTrue(result.edges().isEmpty());
            assertTrue(result.clustering().clusters().isEmpty());
            assertEquals(List.of("b1", "b2"), result.clustering().singletons());
            assertEquals(2, result.records().size());
            assertTrue(result.masters().isEmpty());
        }
        
        @Test
        @DisplayName("singleton promotion should give each record its own master")
        void shouldPromoteSingletons() {
            ResolutionSettings settings = ResolutionFixtures.settings().withSingletonPromotion(true);
            
            ResolutionResult result = engine.resolve(ResolutionFixtures.scenarioB(), settings);
            
            assertEquals(2, result.masters().size());
            assertEquals(2, result.records().size());
            assertNotEquals(result.masters().get(0).id(), result.masters().get(1).id());
        }
    }
    
    @Nested
    @DisplayName("Scenario C: chained identities")
    class ChainedIdentities {
        
        @Test
        @DisplayName("should group the whole chain although no pair shares two fields")
        void shouldGroupChain() {
            ResolutionResult result = engine.resolve(ResolutionFixtures.scenariosAandC(), ResolutionFixtures.settings());
            
            Map<String, Integer> clusters = result.clustering().assignments();
            Integer chain = clusters.get("c1");
            assertNotNull(chain);
            for (String id : List.of("c2", "c3", "c4", "c5")) {
                assertEquals(chain, clusters.get(id), id);
            }
            assertNotEquals(chain, clusters.get("a1"));
            assertEquals(2, result.clustering().clusters().size());
        }
        
        @Test
        @DisplayName("the chain on its own should resolve to a single master")
        void shouldGroupLoneChain() {
            ResolutionResult result = engine.resolve(ResolutionFixtures.scenarioC(), ResolutionFixtures.settings());
            
            assertEquals(1, result.clustering().clusters().size());
            assertEquals(List.of("c1", "c2", "c3", "c4", "c5"), result.clustering().clusters().get(0).memberIds());
            assertTrue(result.clustering().singletons().isEmpty());
            assertEquals(1, result.masters().size());
            assertEquals(1, result.records().size());
        }
        
        @Test
        @DisplayName("weak address edges should stay in the graph without driving clusters")
        void shouldKeepWeakEdges() {
            ResolutionResult result = engine.resolve(ResolutionFixtures.scenariosAandC(), ResolutionFixtures.settings());
            
            assertTrue(result.edges().stream()
                .anyMatch(e -> e.sourceId().equals("c1") && e.targetId().equals("c3") && e.score() < 0.3));
        }
    }
    
    @Nested
    @DisplayName("Determinism")
    class Determinism {
        
        @Test
        @DisplayName("input order should not change any output")
        void shouldIgnoreInputOrder() {
            List<Record> shuffled = new ArrayList<>(ResolutionFixtures.scenariosAandC());
            shuffled.addAll(ResolutionFixtures.scenarioB());
            List<Record> ordered = new ArrayList<>(shuffled);
            Collections.shuffle(shuffled, new Random(7));
            
            ResolutionResult first = engine.resolve(ordered, ResolutionFixtures.settings());
            ResolutionResult second = engine.resolve(shuffled, ResolutionFixtures.settings());
            
            assertEquals(first.edges(), second.edges());
            assertEquals(first.clustering(), second.clustering());
            assertEquals(first.masters(), second.masters());
            assertEquals(first.assignments(), second.assignments());
            assertEquals(first.records(), second.records());
        }
        
        @Test
        @DisplayName("thread count should not change any output")
        void shouldIgnoreThreadCount() {
            ResolutionSettings single = ResolutionFixtures.settingsBuilder().threads(1).batchSize(50).build();
            ResolutionSettings many = ResolutionFixtures.settingsBuilder().threads(4).batchSize(1).build();
            
            ResolutionResult first = engine.resolve(ResolutionFixtures.scenariosAandC(), single);
            ResolutionResult second = engine.resolve(ResolutionFixtures.scenariosAandC(), many);
            
            assertEquals(first.edges(), second.edges());
            assertEquals(first.clustering(), second.clustering());
            assertEquals(first.records(), second.records());
        }
        
        @Test
        @DisplayName("verification runs should pass for the default algorithms")
        void shouldPassVerification() {
            ResolutionSettings settings = ResolutionFixtures.settingsBuilder().verificationRuns(3).build();
            
            assertDoesNotThrow(() -> engine.resolve(ResolutionFixtures.scenariosAandC(), settings));
        }
    }
    
    @Nested
    @DisplayName("Ingest validation")
    class IngestValidation {
        
        @Test
        @DisplayName("should reject blank and duplicate ids and continue")
        void shouldRejectMalformedRecords() {
            List<Record> records = new ArrayList<>(ResolutionFixtures.scenarioA());
            records.add(ResolutionFixtures.record(" ", "John Smith", null, null, null, "30301"));
            records.add(ResolutionFixtures.record(null, "John Smith", null, null, null, "30301"));
            records.add(ResolutionFixtures.record("a1", "Someone Else", null, null, null, "99999"));
            
            ResolutionResult result = engine.resolve(records, ResolutionFixtures.settings());
            
            assertEquals(3, result.rejections().size());
            assertEquals("a1", result.rejections().get(2).recordId());
            assertEquals(8, result.statistics().inputRecords());
            assertEquals(5, result.statistics().acceptedRecords());
            assertEquals(1, result.clustering().clusters().size());
        }
        
        @Test
        @DisplayName("should reject ids containing a NUL character")
        void shouldRejectNulInId() {
            List<Record> records = new ArrayList<>(ResolutionFixtures.scenarioA());
            records.add(ResolutionFixtures.record("a1\u0000a2", "John Smith", null, null, null, "30301"));
            
            ResolutionResult result = engine.resolve(records, ResolutionFixtures.settings());
            
            assertEquals(1, result.rejections().size());
            assertEquals("a1\u0000a2", result.rejections().get(0).recordId());
            assertTrue(result.rejections().get(0).reason().contains("NUL"));
            assertEquals(5, result.statistics().acceptedRecords());
        }
        
        @Test
        @DisplayName("empty input should produce an empty result")
        void shouldHandleEmptyInput() {
            ResolutionResult result = engine.resolve(List.of(), ResolutionFixtures.settings());
            
            assertTrue(result.edges().isEmpty());
            assertTrue(result.records().isEmpty());
            assertTrue(result.warnings().isEmpty());
        }
        
        @Test
        @DisplayName("should require a configuration for the configured run")
        void shouldRequireConfiguration() {
            InMemoryResolutionStore store = new InMemoryResolutionStore();
            InMemoryRecordSource source = new InMemoryRecordSource(ResolutionFixtures.scenarioA());
            
            assertThrows(ConfigurationException.class, engine::settings);
            assertThrows(ConfigurationException.class, () -> engine.run(source, store));
        }
    }
    
    @Test
    @DisplayName("raising the low threshold should never add edges")
    void shouldBeMonotonicInLowThreshold() {
        ResolutionSettings loose = ResolutionFixtures.settings();
        ResolutionSettings strict = ResolutionFixtures.settingsBuilder().lowThreshold(0.3).build();
        
        int looseEdges = engine.resolve(ResolutionFixtures.scenariosAandC(), loose).edges().size();
        int strictEdges = engine.resolve(ResolutionFixtures.scenariosAandC(), strict).edges().size();
        
        assertTrue(strictEdges <= looseEdges);
    }
    
    @Nested
    @DisplayName("Sink output")
    class SinkOutput {
        
        @Test
        @DisplayName("should write outputs in pipeline order")
        void shouldWriteInOrder() {
            // Arrange
            ResolutionSink sink = mock(ResolutionSink.class);
            InMemoryRecordSource source = new InMemoryRecordSource(ResolutionFixtures.scenarioA());
            
            // Act
            engine.run(source, sink, ResolutionFixtures.settings());
            
            // Assert
            InOrder order = inOrder(sink);
            order.verify(sink).writeEdges(anyList());
            order.verify(sink).writeClusters(anyMap());
            order.verify(sink).writeMasterEntities(anyList());
            order.verify(sink).writeAssignments(anyMap());
            order.verify(sink).writeResolution(any());
            verify(sink, never()).writeNormalized(anyString(), any(), anyString());
        }
        
        @Test
        @DisplayName("should write normalized values back when persistence is on")
        void shouldPersistNormalized() {
            InMemoryResolutionStore store = new InMemoryResolutionStore();
            ResolutionSettings settings = ResolutionFixtures.settingsBuilder().persistNormalized(true).build();
            
            ResolutionResult result = engine.run(new InMemoryRecordSource(ResolutionFixtures.scenarioA()), store, settings);
            
            assertEquals(5, store.normalizedRecordCount());
            assertEquals("john smith", store.normalizedValue("a4", FieldType.NAME));
            assertEquals("5551234567", store.normalizedValue("a3", FieldType.PHONE));
            assertEquals(result.edges(), store.getEdges());
            assertEquals(result.assignments(), store.getAssignments());
            
            Cluster cluster = result.clustering().clusters().get(0);
            assertEquals(cluster.id(), store.getClusters().get("a1"));
            assertEquals(result.resolution(), store.getResolution());
        }
    }
}
