package br.edu.ifba.resolution.core;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration for entity resolution.
 * 
 * All properties are read from application.properties with the prefix
 * "resolution". Values are checked and frozen into a {@link ResolutionSettings}
 * once per run; components never read this mapping directly.
 */
@ConfigMapping(prefix = "resolution")
public interface ResolutionConfig {
    
    /**
     * Resolution mode: MERGE or LINK. Has no default; a run without it
     * fails before any record is processed.
     */
    Optional<String> mode();
    
    /**
     * Blocking configuration group.
     */
    Blocking blocking();
    
    /**
     * Scoring configuration group.
     */
    Scoring scoring();
    
    /**
     * Threshold configuration group.
     */
    Thresholds thresholds();
    
    /**
     * Clustering configuration group.
     */
    Clustering clustering();
    
    /**
     * Create master entities for records without qualifying edges.
     * Default: false
     */
    @WithName("singleton-promotion")
    @WithDefault("false")
    boolean singletonPromotion();
    
    /**
     * Normalization configuration group.
     */
    Normalization normalization();
    
    /**
     * Parallel processing configuration group.
     */
    Parallel parallel();
    
    /**
     * Blocking configuration.
     */
    interface Blocking {
        /**
         * Block-key field combinations, e.g. {@code name:3+postal_code,phone:6,email}.
         */
        List<String> rules();
        
        /**
         * Catch-all block ceiling.
         */
        CatchAll catchAll();
        
        interface CatchAll {
            /**
             * Largest catch-all block compared without a warning.
             * Default: 1000
             */
            @WithDefault("1000")
            @Min(1)
            int maxSize();
            
            /**
             * Overflow policy: SAMPLE, SKIP or PROCEED.
             * Default: SAMPLE
             */
            @WithDefault("SAMPLE")
            String overflow();
        }
    }
    
    /**
     * Scoring configuration.
     */
    interface Scoring {
        /**
         * Missing-field policy: IGNORE or PENALIZE.
         * Default: IGNORE
         */
        @WithDefault("IGNORE")
        String missingFields();
        
        /**
         * Per-field metric and weight, keyed by field (name, email, phone, address, postal_code).
         */
        Map<String, Field> fields();
        
        interface Field {
            /**
             * Metric name: jaro-winkler, levenshtein, exact or token-jaccard.
             */
            String metric();
            
            /**
             * Weight in the aggregated score. Weights of all fields must sum to 1.0.
             */
            @Min(0)
            @Max(1)
            double weight();
        }
    }
    
    /**
     * Threshold configuration.
     */
    interface Thresholds {
        /**
         * Minimum aggregated score for a pair to become an edge [0.0, 1.0].
         */
        @Min(0)
        @Max(1)
        double low();
        
        /**
         * Minimum edge score feeding cluster extraction [0.0, 1.0].
         */
        @Min(0)
        @Max(1)
        double high();
    }
    
    /**
     * Clustering configuration.
     */
    interface Clustering {
        /**
         * Community detection algorithm: "louvain" or "connected-components".
         * Default: "louvain"
         */
        @WithDefault("louvain")
        String algorithm();
        
        /**
         * Random seed for the community detection's initialization.
         */
        long seed();
        
        /**
         * Modularity resolution (gamma). Lower values favor larger communities.
         * Default: 0.3, which keeps chains of linked records in one cluster
         */
        @WithDefault("0.3")
        double resolution();
        
        /**
         * Extra partitions compared against the first one; 0 disables verification.
         * Default: 0
         */
        @WithName("verification-runs")
        @WithDefault("0")
        @Min(0)
        int verificationRuns();
    }
    
    /**
     * Normalization configuration.
     */
    interface Normalization {
        /**
         * Write normalized values back through the sink.
         * Default: false
         */
        @WithDefault("false")
        boolean persist();
        
        /**
         * Phone normalization.
         */
        Phone phone();
        
        interface Phone {
            /**
             * Country-code prefix dropped from phone numbers. Unset keeps every digit.
             */
            @WithName("country-code")
            Optional<String> countryCode();
            
            /**
             * Digits of a national number, used to recognize a country-code prefix.
             * Default: 10
             */
            @WithName("national-length")
            @WithDefault("10")
            @Min(1)
            int nationalLength();
        }
    }
    
    /**
     * Parallel processing configuration.
     */
    interface Parallel {
        /**
         * Worker threads for normalization and block scoring.
         * Default: 4
         */
        @WithDefault("4")
        @Min(1)
        int threads();
        
        /**
         * Records or blocks handed to a worker per task.
         * Default: 200
         */
        @WithName("batch-size")
        @WithDefault("200")
        @Min(1)
        int batchSize();
    }
}
