package br.edu.ifba.resolution.similarity;

import br.edu.ifba.resolution.core.FieldType;
import br.edu.ifba.resolution.core.NormalizedRecord;
import br.edu.ifba.resolution.core.ResolutionSettings;
import br.edu.ifba.resolution.graph.SimilarityEdge;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scores candidate pairs field by field and aggregates the field scores into
 * one weighted similarity.
 * 
 * <p>Scoring is symmetric and deterministic: records are put in id order before
 * comparison and every metric is symmetric, so {@code score(a, b)} always
 * equals {@code score(b, a)}.</p>
 */
@ApplicationScoped
public class PairScorer {
    
    private static final Logger logger = LoggerFactory.getLogger(PairScorer.class);
    
    /**
     * Computes per-field scores and the aggregated score of two records.
     * 
     * <p>A field is compared only when it is configured and comparable on both
     * sides. Under {@link MissingFieldPolicy#IGNORE} the remaining weights are
     * renormalized; under {@link MissingFieldPolicy#PENALIZE} a missing field
     * contributes 0.0 with its full weight.</p>
     *
     * @param record1 first record (must not be null)
     * @param record2 second record (must not be null)
     * @param settings run settings
     * @return the scored pair
     */
    @NotNull
    public SimilarityEdge score(
            @NotNull NormalizedRecord record1,
            @NotNull NormalizedRecord record2,
            @NotNull ResolutionSettings settings) {
        
        if (record1 == null) {
            throw new IllegalArgumentException("record1 cannot be null");
        }
        if (record2 == null) {
            throw new IllegalArgumentException("record2 cannot be null");
        }
        
        NormalizedRecord first = record1.id().compareTo(record2.id()) <= 0 ? record1 : record2;
        NormalizedRecord second = first == record1 ? record2 : record1;
        
        Map<FieldType, Double> fieldScores = new EnumMap<>(FieldType.class);
        double weightedSum = 0.0;
        double weightTotal = 0.0;
        
        for (Map.Entry<FieldType, FieldScoring> entry : settings.fieldScoring().entrySet()) {
            FieldType field = entry.getKey();
            FieldScoring scoring = entry.getValue();
            
            String value1 = first.comparable(field);
            String value2 = second.comparable(field);
            
            if (value1 == null || value2 == null) {
                if (settings.missingFieldPolicy() == MissingFieldPolicy.PENALIZE) {
                    weightTotal += scoring.weight();
                }
                continue;
            }
            
            double fieldScore = StringSimilarity.compute(scoring.metric(), value1, value2);
            fieldScores.put(field, fieldScore);
            weightedSum += scoring.weight() * fieldScore;
            weightTotal += scoring.weight();
        }
        
        double aggregated = weightTotal > 0.0 ? weightedSum / weightTotal : 0.0;
        // Guard against rounding drift outside [0, 1]
        aggregated = Math.max(0.0, Math.min(1.0, aggregated));
        
        return new SimilarityEdge(first.id(), second.id(), fieldScores, aggregated);
    }
    
    /**
     * Scores a pair and keeps it only when it reaches the low threshold.
     */
    @NotNull
    public Optional<SimilarityEdge> edgeFor(
            @NotNull NormalizedRecord record1,
            @NotNull NormalizedRecord record2,
            @NotNull ResolutionSettings settings) {
        
        SimilarityEdge edge = score(record1, record2, settings);
        if (edge.score() >= settings.lowThreshold()) {
            if (logger.isDebugEnabled()) {
                logger.debug("{}", edge.toLogString());
            }
            return Optional.of(edge);
        }
        return Optional.empty();
    }
    
    /**
     * Scores every pair of a block and returns the edges reaching the low threshold.
     * Pure: the caller merges the result into the graph.
     *
     * @param block records sharing a block key
     * @param settings run settings
     * @return edges in block order
     */
    @NotNull
    public List<SimilarityEdge> scoreBlock(@NotNull List<NormalizedRecord> block, @NotNull ResolutionSettings settings) {
        return scoreRows(block, 0, block.size(), settings);
    }
    
    /**
     * Scores the pairs (i, j) of a block with {@code fromRow <= i < toRow} and
     * {@code j > i}. Lets large blocks be split across workers.
     */
    @NotNull
    public List<SimilarityEdge> scoreRows(
            @NotNull List<NormalizedRecord> block,
            int fromRow,
            int toRow,
            @NotNull ResolutionSettings settings) {
        
        List<SimilarityEdge> edges = new ArrayList<>();
        int n = block.size();
        
        for (int i = fromRow; i < Math.min(toRow, n); i++) {
            for (int j = i + 1; j < n; j++) {
                NormalizedRecord a = block.get(i);
                NormalizedRecord b = block.get(j);
                if (a.id().equals(b.id())) {
                    continue;
                }
                edgeFor(a, b, settings).ifPresent(edges::add);
            }
        }
        
        return edges;
    }
}
