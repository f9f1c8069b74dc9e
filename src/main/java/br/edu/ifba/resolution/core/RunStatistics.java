package br.edu.ifba.resolution.core;

/**
 * Counters and stage timings of one run.
 */
public record RunStatistics(
    int inputRecords,
    int acceptedRecords,
    int blocks,
    long candidatePairs,
    int edges,
    int clusters,
    int singletons,
    long normalizationMs,
    long blockingMs,
    long scoringMs,
    long clusteringMs,
    long resolutionMs
) {
    
    public long totalMs() {
        return normalizationMs + blockingMs + scoringMs + clusteringMs + resolutionMs;
    }
}
