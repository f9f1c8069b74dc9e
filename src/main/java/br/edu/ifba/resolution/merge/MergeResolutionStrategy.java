package br.edu.ifba.resolution.merge;

import br.edu.ifba.resolution.cluster.Cluster;
import br.edu.ifba.resolution.cluster.Clustering;
import br.edu.ifba.resolution.core.NormalizedRecord;
import br.edu.ifba.resolution.core.Record;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collapses each cluster into its master record. Members are dropped;
 * unclustered records pass through unchanged.
 */
@ApplicationScoped
public class MergeResolutionStrategy implements ResolutionStrategy {
    
    @Override
    public ResolutionMode mode() {
        return ResolutionMode.MERGE;
    }
    
    @NotNull
    @Override
    public Resolution resolve(
            @NotNull List<NormalizedRecord> records,
            @NotNull Clustering clustering,
            @NotNull Map<Integer, MasterEntity> masters) {
        
        Set<String> clustered = clustering.assignments().keySet();
        List<Record> result = new ArrayList<>();
        
        for (Cluster cluster : clustering.clusters()) {
            MasterEntity master = masters.get(cluster.id());
            if (master == null) {
                throw new IllegalStateException("No master entity for cluster " + cluster.id());
            }
            result.add(master.toRecord());
        }
        for (NormalizedRecord record : records) {
            if (!clustered.contains(record.id())) {
                result.add(record.source());
            }
        }
        
        result.sort(Comparator.comparing(Record::id));
        return new Resolution(mode(), result, List.of());
    }
}
