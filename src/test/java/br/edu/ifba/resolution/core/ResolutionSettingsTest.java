package br.edu.ifba.resolution.core;

import br.edu.ifba.exception.ConfigurationException;
import br.edu.ifba.resolution.ResolutionFixtures;
import br.edu.ifba.resolution.blocking.CatchAllOverflow;
import br.edu.ifba.resolution.merge.ResolutionMode;
import br.edu.ifba.resolution.similarity.MissingFieldPolicy;
import br.edu.ifba.resolution.similarity.SimilarityMetric;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Validation tests for ResolutionSettings.
 */
class ResolutionSettingsTest {
    
    @Test
    @DisplayName("should build valid settings with defaults")
    void shouldBuildWithDefaults() {
        ResolutionSettings settings = ResolutionFixtures.settings();
        
        assertEquals(ResolutionMode.MERGE, settings.mode());
        assertEquals(4, settings.blockingRules().size());
        assertEquals(SimilarityMetric.JARO_WINKLER, settings.fieldScoring().get(FieldType.NAME).metric());
        assertEquals(MissingFieldPolicy.IGNORE, settings.missingFieldPolicy());
        assertEquals(CatchAllOverflow.SAMPLE, settings.catchAllOverflow());
        assertEquals(1000, settings.catchAllMaxSize());
        assertEquals("louvain", settings.algorithm());
        assertEquals("1", settings.phoneCountryCode());
        assertFalse(settings.singletonPromotion());
    }
    
    @Test
    @DisplayName("should reject weights that do not sum to 1.0")
    void shouldRejectWeightSum() {
        ResolutionSettings.Builder builder = ResolutionFixtures.settingsBuilder().field("address", "token-jaccard", 0.3);
        
        ConfigurationException e = assertThrows(ConfigurationException.class, builder::build);
        assertTrue(e.getMessage().contains("sum to 1.0"), e.getMessage());
    }
    
    @Test
    @DisplayName("should reject an unknown metric")
    void shouldRejectUnknownMetric() {
        ResolutionSettings.Builder builder = ResolutionFixtures.settingsBuilder().field("name", "soundex", 0.4);
        
        assertThrows(ConfigurationException.class, builder::build);
    }
    
    @Test
    @DisplayName("should reject an unknown field")
    void shouldRejectUnknownField() {
        ResolutionSettings.Builder builder = ResolutionSettings.builder()
            .mode("LINK")
            .field("shoe_size", "exact", 1.0)
            .lowThreshold(0.5)
            .highThreshold(0.8)
            .seed(1L);
        
        assertThrows(ConfigurationException.class, builder::build);
    }
    
    @Test
    @DisplayName("should reject a missing or unknown mode")
    void shouldRejectMode() {
        assertThrows(ConfigurationException.class, () -> ResolutionFixtures.settingsBuilder().mode((String) null).build());
        assertThrows(ConfigurationException.class, () -> ResolutionFixtures.settingsBuilder().mode("DEDUPE").build());
    }
    
    @Test
    @DisplayName("should reject thresholds out of range or inverted")
    void shouldRejectThresholds() {
        assertThrows(ConfigurationException.class,
            () -> ResolutionFixtures.settingsBuilder().lowThreshold(-0.1).build());
        assertThrows(ConfigurationException.class,
            () -> ResolutionFixtures.settingsBuilder().highThreshold(1.5).build());
        assertThrows(ConfigurationException.class,
            () -> ResolutionFixtures.settingsBuilder().lowThreshold(0.9).highThreshold(0.5).build());
    }
    
    @Test
    @DisplayName("should reject a malformed blocking rule")
    void shouldRejectBlockingRule() {
        assertThrows(ConfigurationException.class,
            () -> ResolutionFixtures.settingsBuilder().blockingRule("name:x").build());
        assertThrows(ConfigurationException.class,
            () -> ResolutionFixtures.settingsBuilder().blockingRule("name++postal_code").build());
    }
    
    @Test
    @DisplayName("should reject non-positive sizes")
    void shouldRejectSizes() {
        assertThrows(ConfigurationException.class, () -> ResolutionFixtures.settingsBuilder().threads(0).build());
        assertThrows(ConfigurationException.class, () -> ResolutionFixtures.settingsBuilder().batchSize(0).build());
        assertThrows(ConfigurationException.class, () -> ResolutionFixtures.settingsBuilder().catchAllMaxSize(0).build());
    }
    
    @Test
    @DisplayName("should require a seed")
    void shouldRequireSeed() {
        ResolutionSettings.Builder builder = ResolutionSettings.builder()
            .mode(ResolutionMode.MERGE)
            .field(FieldType.NAME, SimilarityMetric.JARO_WINKLER, 1.0)
            .lowThreshold(0.5)
            .highThreshold(0.8);
        
        assertThrows(ConfigurationException.class, builder::build);
    }
    
    @Test
    @DisplayName("withMode should keep every other setting")
    void shouldCopyWithMode() {
        ResolutionSettings settings = ResolutionFixtures.settings();
        
        ResolutionSettings link = settings.withMode(ResolutionMode.LINK);
        
        assertEquals(ResolutionMode.LINK, link.mode());
        assertEquals(settings.blockingRules(), link.blockingRules());
        assertEquals(settings.fieldScoring(), link.fieldScoring());
        assertEquals(settings.seed(), link.seed());
    }
}
