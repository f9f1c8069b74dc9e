package br.edu.ifba.resolution.core;

import br.edu.ifba.resolution.blocking.CatchAllOverflow;

/**
 * Raised when the catch-all block outgrows its ceiling. Reported in the run
 * result instead of thrown: the run continues under the overflow policy.
 *
 * @param blockSize records that fell into the catch-all block
 * @param maxSize configured ceiling
 * @param policy overflow policy applied
 * @param comparedRecords records actually compared in the block after the policy
 */
public record BlockingExhaustionWarning(int blockSize, int maxSize, CatchAllOverflow policy, int comparedRecords) {
    
    public String message() {
        return String.format(
            "Catch-all block holds %d records (max %d); applied %s, comparing %d records",
            blockSize, maxSize, policy, comparedRecords
        );
    }
}
