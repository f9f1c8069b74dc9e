package br.edu.ifba.resolution.similarity;

/**
 * Scoring setup for one field.
 *
 * @param metric similarity metric
 * @param weight weight in the aggregated score [0.0, 1.0]
 */
public record FieldScoring(SimilarityMetric metric, double weight) {
    
    public FieldScoring {
        if (metric == null) {
            throw new IllegalArgumentException("metric cannot be null");
        }
        if (weight < 0.0 || weight > 1.0) {
            throw new IllegalArgumentException("weight must be in [0.0, 1.0], got " + weight);
        }
    }
}
