package br.edu.ifba.resolution.merge;

import br.edu.ifba.resolution.ResolutionFixtures;
import br.edu.ifba.resolution.cluster.Cluster;
import br.edu.ifba.resolution.cluster.Clustering;
import br.edu.ifba.resolution.core.NormalizedRecord;
import br.edu.ifba.resolution.core.Record;
import br.edu.ifba.resolution.core.RecordNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the merge and link resolution strategies.
 */
class ResolutionStrategyTest {
    
    private List<NormalizedRecord> records;
    private Clustering clustering;
    private Map<Integer, MasterEntity> masters;
    
    @BeforeEach
    void setUp() {
        RecordNormalizer normalizer = new RecordNormalizer();
        List<Record> raw = new ArrayList<>(ResolutionFixtures.scenarioA());
        raw.addAll(ResolutionFixtures.scenarioB());
        
        records = new ArrayList<>();
        Map<String, NormalizedRecord> byId = new TreeMap<>();
        for (Record record : raw) {
            NormalizedRecord normalized = normalizer.normalize(record, ResolutionFixtures.settings());
            records.add(normalized);
            byId.put(normalized.id(), normalized);
        }
        
        clustering = new Clustering(
            List.of(new Cluster(1, List.of("a1", "a2", "a3", "a4", "a5"))),
            List.of("b1", "b2"),
            "louvain"
        );
        masters = new MasterEntityBuilder().buildAll(clustering.clusters(), byId);
    }
    
    @Nested
    @DisplayName("Merge mode")
    class Merge {
        
        @Test
        @DisplayName("should replace each cluster by its master and keep singletons")
        void shouldMerge() {
            Resolution resolution = new MergeResolutionStrategy().resolve(records, clustering, masters);
            
            assertEquals(ResolutionMode.MERGE, resolution.mode());
            assertEquals(3, resolution.records().size());
            assertTrue(resolution.links().isEmpty());
            
            List<String> ids = resolution.records().stream().map(Record::id).collect(Collectors.toList());
            assertTrue(ids.contains(masters.get(1).id()));
            assertTrue(ids.contains("b1"));
            assertTrue(ids.contains("b2"));
            assertFalse(ids.contains("a1"));
        }
        
        @Test
        @DisplayName("merged record should carry canonical originals under source keys")
        void shouldCarryCanonicalFields() {
            Resolution resolution = new MergeResolutionStrategy().resolve(records, clustering, masters);
            
            Record merged = resolution.records().stream()
                .filter(r -> r.id().equals(masters.get(1).id()))
                .findFirst()
                .orElseThrow();
            assertEquals("John Smith", merged.fields().get("full_name"));
            assertEquals("30301", merged.fields().get("postal_code"));
        }
        
        @Test
        @DisplayName("should fail when a cluster has no master")
        void shouldFailWithoutMaster() {
            MergeResolutionStrategy strategy = new MergeResolutionStrategy();
            
            assertThrows(IllegalStateException.class, () -> strategy.resolve(records, clustering, Map.of()));
        }
    }
    
    @Nested
    @DisplayName("Link mode")
    class Link {
        
        @Test
        @DisplayName("should keep every record and link every clustered pair")
        void shouldLink() {
            Resolution resolution = new LinkResolutionStrategy().resolve(records, clustering, masters);
            
            assertEquals(ResolutionMode.LINK, resolution.mode());
            assertEquals(7, resolution.records().size());
            assertEquals(10, resolution.links().size());
            assertTrue(resolution.links().contains(new SameAsLink("a1", "a5", 1)));
            assertTrue(resolution.links().stream().allMatch(l -> l.clusterId() == 1));
        }
        
        @Test
        @DisplayName("links should order their endpoints")
        void shouldOrderEndpoints() {
            SameAsLink link = new SameAsLink("b2", "b1", 3);
            
            assertEquals("b1", link.recordId1());
            assertEquals("b2", link.recordId2());
            assertThrows(IllegalArgumentException.class, () -> new SameAsLink("b1", "b1", 3));
        }
    }
    
    @Test
    @DisplayName("factory should return the strategy for each mode")
    void shouldResolveStrategyByMode() {
        ResolutionStrategyFactory factory = new ResolutionStrategyFactory(
            List.<ResolutionStrategy>of(new MergeResolutionStrategy(), new LinkResolutionStrategy())
        );
        
        assertInstanceOf(MergeResolutionStrategy.class, factory.getStrategy(ResolutionMode.MERGE));
        assertInstanceOf(LinkResolutionStrategy.class, factory.getStrategy(ResolutionMode.LINK));
    }
}
