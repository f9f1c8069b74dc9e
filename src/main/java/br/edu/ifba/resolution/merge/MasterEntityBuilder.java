package br.edu.ifba.resolution.merge;

import br.edu.ifba.resolution.cluster.Cluster;
import br.edu.ifba.resolution.core.FieldType;
import br.edu.ifba.resolution.core.FieldValue;
import br.edu.ifba.resolution.core.NormalizedRecord;
import br.edu.ifba.shared.UuidUtils;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Synthesizes canonical attributes for each cluster.
 * 
 * <p>Field policies:</p>
 * <ul>
 *   <li>{@code NAME}, {@code ADDRESS}, {@code POSTAL_CODE}: most frequent
 *       normalized value; ties go to the value held by the lowest record id.</li>
 *   <li>{@code EMAIL}, {@code PHONE}: most frequent value when one value is
 *       strictly ahead, otherwise the longest value (ties to the lowest record id).</li>
 * </ul>
 * <p>The canonical original is the raw value of the lowest record id holding
 * the canonical normalized value.</p>
 */
@ApplicationScoped
public class MasterEntityBuilder {
    
    private static final Logger logger = LoggerFactory.getLogger(MasterEntityBuilder.class);
    
    /**
     * Builds the master entity of a cluster.
     *
     * @param cluster the cluster
     * @param recordsById normalized records, must contain every member
     * @return the master entity
     */
    @NotNull
    public MasterEntity build(@NotNull Cluster cluster, @NotNull Map<String, NormalizedRecord> recordsById) {
        List<NormalizedRecord> members = new ArrayList<>(cluster.size());
        for (String memberId : cluster.memberIds()) {
            NormalizedRecord member = recordsById.get(memberId);
            if (member == null) {
                throw new IllegalArgumentException("Unknown cluster member: " + memberId);
            }
            members.add(member);
        }
        
        Map<FieldType, FieldValue> attributes = new EnumMap<>(FieldType.class);
        for (FieldType field : FieldType.values()) {
            FieldValue canonical = canonicalValue(field, members);
            if (canonical != null) {
                attributes.put(field, canonical);
            }
        }
        
        MasterEntity master = new MasterEntity(
            UuidUtils.masterEntityId(cluster.memberIds()).toString(),
            cluster.id(),
            cluster.memberIds(),
            attributes
        );
        
        logger.debug("Master {} for cluster {} ({} members): name='{}'",
                    master.id(), cluster.id(), cluster.size(), master.normalized(FieldType.NAME));
        return master;
    }
    
    /**
     * Builds one master per cluster, keyed by cluster id.
     */
    @NotNull
    public Map<Integer, MasterEntity> buildAll(@NotNull List<Cluster> clusters, @NotNull Map<String, NormalizedRecord> recordsById) {
        Map<Integer, MasterEntity> masters = new TreeMap<>();
        for (Cluster cluster : clusters) {
            masters.put(cluster.id(), build(cluster, recordsById));
        }
        return masters;
    }
    
    /**
     * Record id to master id for every member of every master.
     */
    @NotNull
    public static Map<String, String> assignments(@NotNull Map<Integer, MasterEntity> masters) {
        Map<String, String> assignments = new TreeMap<>();
        for (MasterEntity master : masters.values()) {
            for (String member : master.memberIds()) {
                assignments.put(member, master.id());
            }
        }
        return assignments;
    }
    
    /**
     * @param members cluster members in ascending id order
     */
    @Nullable
    FieldValue canonicalValue(FieldType field, List<NormalizedRecord> members) {
        // Normalized value -> count, in order of first holder (lowest id first)
        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, String> originals = new LinkedHashMap<>();
        for (NormalizedRecord member : members) {
            FieldValue value = member.value(field);
            if (value == null || value.normalized().isBlank()) {
                continue;
            }
            counts.merge(value.normalized(), 1, Integer::sum);
            originals.putIfAbsent(value.normalized(), value.original());
        }
        
        if (counts.isEmpty()) {
            return null;
        }
        
        String chosen;
        if (field == FieldType.EMAIL || field == FieldType.PHONE) {
            chosen = strictPlurality(counts);
            if (chosen == null) {
                chosen = longest(counts);
            }
        } else {
            chosen = plurality(counts);
        }
        
        return new FieldValue(originals.get(chosen), chosen);
    }
    
    /**
     * Most frequent value; the first one seen wins ties.
     */
    private static String plurality(Map<String, Integer> counts) {
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }
    
    /**
     * Most frequent value, or null when the top count is shared.
     */
    @Nullable
    private static String strictPlurality(Map<String, Integer> counts) {
        String best = plurality(counts);
        int bestCount = counts.get(best);
        long holders = counts.values().stream().filter(c -> c == bestCount).count();
        return holders == 1 ? best : null;
    }
    
    /**
     * Longest value; the first one seen wins ties.
     */
    private static String longest(Map<String, Integer> counts) {
        String best = null;
        for (String value : counts.keySet()) {
            if (best == null || value.length() > best.length()) {
                best = value;
            }
        }
        return best;
    }
}
