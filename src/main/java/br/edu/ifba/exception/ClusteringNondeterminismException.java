package br.edu.ifba.exception;

/**
 * Thrown in verification mode when repeated partitions of the same graph
 * with the same seed disagree. Signals a regression in the community
 * detection algorithm, not a runtime condition to recover from.
 */
public class ClusteringNondeterminismException extends RuntimeException {
    
    private final String algorithm;
    private final int run;
    
    public ClusteringNondeterminismException(final String algorithm, final int run, final String message) {
        super(message);
        this.algorithm = algorithm;
        this.run = run;
    }
    
    public String getAlgorithm() {
        return algorithm;
    }
    
    /**
     * @return the 1-based verification run that diverged from the first partition
     */
    public int getRun() {
        return run;
    }
}
