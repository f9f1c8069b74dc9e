package br.edu.ifba.resolution.blocking;

import br.edu.ifba.resolution.ResolutionFixtures;
import br.edu.ifba.resolution.core.NormalizedRecord;
import br.edu.ifba.resolution.core.Record;
import br.edu.ifba.resolution.core.RecordNormalizer;
import br.edu.ifba.resolution.core.ResolutionSettings;
import br.edu.ifba.resolution.similarity.PairScorer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Blocker.
 */
class BlockerTest {
    
    private final RecordNormalizer normalizer = new RecordNormalizer();
    private final Blocker blocker = new Blocker();
    
    private List<NormalizedRecord> normalize(List<Record> records, ResolutionSettings settings) {
        return records.stream().map(r -> normalizer.normalize(r, settings)).collect(Collectors.toList());
    }
    
    @Test
    @DisplayName("should group records sharing a key and drop single-member blocks")
    void shouldGroupByKey() {
        ResolutionSettings settings = ResolutionFixtures.settings();
        
        BlockAssignment assignment = blocker.assign(normalize(ResolutionFixtures.scenarioA(), settings), settings);
        
        Map<String, List<NormalizedRecord>> blocks = assignment.blocks();
        assertEquals(4, blocks.get("0|joh|30301").size());
        assertFalse(blocks.containsKey("0|jon|30301"), "a2 alone in its name block");
        assertEquals(5, blocks.get("1|30301").size());
        assertEquals(5, blocks.get("2|555123").size());
        assertTrue(assignment.exhaustionWarning().isEmpty());
    }
    
    @Test
    @DisplayName("should be independent of input order")
    void shouldIgnoreInputOrder() {
        ResolutionSettings settings = ResolutionFixtures.settings();
        List<Record> shuffled = new ArrayList<>(ResolutionFixtures.scenariosAandC());
        Collections.reverse(shuffled);
        
        BlockAssignment first = blocker.assign(normalize(ResolutionFixtures.scenariosAandC(), settings), settings);
        BlockAssignment second = blocker.assign(normalize(shuffled, settings), settings);
        
        assertEquals(first.blocks(), second.blocks());
    }
    
    @Test
    @DisplayName("should put every pair scoring above the low threshold in a shared block")
    void shouldBeSupersetOfMatches() {
        ResolutionSettings settings = ResolutionFixtures.settings();
        PairScorer scorer = new PairScorer();
        List<NormalizedRecord> records = normalize(ResolutionFixtures.scenariosAandC(), settings);
        
        for (int i = 0; i < records.size(); i++) {
            for (int j = i + 1; j < records.size(); j++) {
                NormalizedRecord a = records.get(i);
                NormalizedRecord b = records.get(j);
                if (scorer.score(a, b, settings).score() >= settings.lowThreshold()) {
                    assertTrue(blocker.shareBlock(a, b, settings), a.id() + " / " + b.id());
                }
            }
        }
    }
    
    @Nested
    @DisplayName("Catch-all block")
    class CatchAll {
        
        private List<Record> keyless(int count) {
            List<Record> records = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                records.add(Record.of(String.format("k%03d", i), Map.of("note", "no typed fields")));
            }
            return records;
        }
        
        @Test
        @DisplayName("should collect records without keys")
        void shouldCollectKeylessRecords() {
            ResolutionSettings settings = ResolutionFixtures.settings();
            
            BlockAssignment assignment = blocker.assign(normalize(keyless(3), settings), settings);
            
            assertEquals(3, assignment.blocks().get(Blocker.CATCH_ALL).size());
            assertTrue(assignment.exhaustionWarning().isEmpty());
        }
        
        @Test
        @DisplayName("SAMPLE should keep a seeded sample of max-size records")
        void shouldSample() {
            ResolutionSettings settings = ResolutionFixtures.settingsBuilder().catchAllMaxSize(5).build();
            
            BlockAssignment first = blocker.assign(normalize(keyless(20), settings), settings);
            BlockAssignment second = blocker.assign(normalize(keyless(20), settings), settings);
            
            assertEquals(5, first.blocks().get(Blocker.CATCH_ALL).size());
            assertEquals(first.blocks(), second.blocks(), "sample must be reproducible");
            assertEquals(20, first.exhaustionWarning().orElseThrow().blockSize());
            assertEquals(CatchAllOverflow.SAMPLE, first.exhaustionWarning().orElseThrow().policy());
        }
        
        @Test
        @DisplayName("SKIP should compare nothing and still warn")
        void shouldSkip() {
            ResolutionSettings settings = ResolutionFixtures.settingsBuilder()
                .catchAllMaxSize(5)
                .catchAllOverflow(CatchAllOverflow.SKIP)
                .build();
            
            BlockAssignment assignment = blocker.assign(normalize(keyless(20), settings), settings);
            
            assertFalse(assignment.blocks().containsKey(Blocker.CATCH_ALL));
            assertEquals(0, assignment.exhaustionWarning().orElseThrow().comparedRecords());
        }
        
        @Test
        @DisplayName("PROCEED should compare everything and still warn")
        void shouldProceed() {
            ResolutionSettings settings = ResolutionFixtures.settingsBuilder()
                .catchAllMaxSize(5)
                .catchAllOverflow("proceed")
                .build();
            
            BlockAssignment assignment = blocker.assign(normalize(keyless(20), settings), settings);
            
            assertEquals(20, assignment.blocks().get(Blocker.CATCH_ALL).size());
            assertTrue(assignment.exhaustionWarning().isPresent());
            assertEquals(190, assignment.candidatePairCount());
        }
    }
}
