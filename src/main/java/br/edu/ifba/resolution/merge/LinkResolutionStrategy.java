package br.edu.ifba.resolution.merge;

import br.edu.ifba.resolution.cluster.Cluster;
import br.edu.ifba.resolution.cluster.Clustering;
import br.edu.ifba.resolution.core.NormalizedRecord;
import br.edu.ifba.resolution.core.Record;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Keeps every record and relates the members of each cluster pairwise.
 */
@ApplicationScoped
public class LinkResolutionStrategy implements ResolutionStrategy {
    
    @Override
    public ResolutionMode mode() {
        return ResolutionMode.LINK;
    }
    
    @NotNull
    @Override
    public Resolution resolve(
            @NotNull List<NormalizedRecord> records,
            @NotNull Clustering clustering,
            @NotNull Map<Integer, MasterEntity> masters) {
        
        List<Record> result = new ArrayList<>(records.size());
        for (NormalizedRecord record : records) {
            result.add(record.source());
        }
        
        List<SameAsLink> links = new ArrayList<>();
        for (Cluster cluster : clustering.clusters()) {
            List<String> members = cluster.memberIds();
            for (int i = 0; i < members.size(); i++) {
                for (int j = i + 1; j < members.size(); j++) {
                    links.add(new SameAsLink(members.get(i), members.get(j), cluster.id()));
                }
            }
        }
        
        return new Resolution(mode(), result, links);
    }
}
