package br.edu.ifba.resolution.blocking;

import br.edu.ifba.resolution.core.BlockingExhaustionWarning;
import br.edu.ifba.resolution.core.NormalizedRecord;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Blocks produced for one run, in deterministic key order.
 *
 * @param blocks block key to member records (sorted by id); the catch-all block uses {@link Blocker#CATCH_ALL}
 * @param warning set when the catch-all block exceeded its ceiling
 */
public record BlockAssignment(Map<String, List<NormalizedRecord>> blocks, @Nullable BlockingExhaustionWarning warning) {
    
    public BlockAssignment {
        Map<String, List<NormalizedRecord>> copy = new LinkedHashMap<>();
        blocks.forEach((key, members) -> copy.put(key, List.copyOf(members)));
        blocks = Collections.unmodifiableMap(copy);
    }
    
    public Optional<BlockingExhaustionWarning> exhaustionWarning() {
        return Optional.ofNullable(warning);
    }
    
    /**
     * Number of candidate pairs the blocks generate, duplicates across blocks included.
     */
    public long candidatePairCount() {
        long pairs = 0;
        for (List<NormalizedRecord> members : blocks.values()) {
            long n = members.size();
            pairs += n * (n - 1) / 2;
        }
        return pairs;
    }
}
