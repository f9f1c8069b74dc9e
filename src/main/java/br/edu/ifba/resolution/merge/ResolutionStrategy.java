package br.edu.ifba.resolution.merge;

import br.edu.ifba.resolution.cluster.Clustering;
import br.edu.ifba.resolution.core.NormalizedRecord;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;

/**
 * Decides what happens to clustered records: collapse them or link them.
 */
public interface ResolutionStrategy {
    
    ResolutionMode mode();
    
    /**
     * @param records accepted records in id order
     * @param clustering extracted clusters
     * @param masters master entity per cluster id
     * @return the resolution
     */
    @NotNull
    Resolution resolve(
        @NotNull List<NormalizedRecord> records,
        @NotNull Clustering clustering,
        @NotNull Map<Integer, MasterEntity> masters
    );
}
