package br.edu.ifba.resolution.core;

import br.edu.ifba.resolution.cluster.Clustering;
import br.edu.ifba.resolution.graph.SimilarityEdge;
import br.edu.ifba.resolution.merge.MasterEntity;
import br.edu.ifba.resolution.merge.Resolution;
import br.edu.ifba.resolution.merge.ResolutionMode;
import br.edu.ifba.resolution.merge.SameAsLink;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Everything a run produced.
 *
 * @param normalizedRecords accepted records, normalized, in id order
 * @param edges similarity edges in pair order
 * @param clustering clusters and singletons
 * @param masters master entities in cluster id order
 * @param assignments record id to master id
 * @param resolution merged records or same-as links
 * @param rejections records refused at ingest
 * @param warnings catch-all overflow warnings
 * @param statistics counters and timings
 */
public record ResolutionResult(
    @NotNull List<NormalizedRecord> normalizedRecords,
    @NotNull List<SimilarityEdge> edges,
    @NotNull Clustering clustering,
    @NotNull List<MasterEntity> masters,
    @NotNull Map<String, String> assignments,
    @NotNull Resolution resolution,
    @NotNull List<RecordRejection> rejections,
    @NotNull List<BlockingExhaustionWarning> warnings,
    @NotNull RunStatistics statistics
) {
    
    public ResolutionResult {
        normalizedRecords = List.copyOf(normalizedRecords);
        edges = List.copyOf(edges);
        masters = List.copyOf(masters);
        assignments = Collections.unmodifiableMap(new TreeMap<>(assignments));
        rejections = List.copyOf(rejections);
        warnings = List.copyOf(warnings);
    }
    
    public ResolutionMode mode() {
        return resolution.mode();
    }
    
    public List<Record> records() {
        return resolution.records();
    }
    
    public List<SameAsLink> links() {
        return resolution.links();
    }
    
    /**
     * Returns a formatted string representation for logging.
     */
    public String toLogString() {
        return String.format(
            "mode=%s, input=%d, accepted=%d, rejected=%d, edges=%d, clusters=%d, singletons=%d, output=%d, links=%d, warnings=%d, took=%dms",
            mode(), statistics.inputRecords(), statistics.acceptedRecords(), rejections.size(), edges.size(),
            clustering.clusters().size(), clustering.singletons().size(), records().size(), links().size(),
            warnings.size(), statistics.totalMs()
        );
    }
}
