package br.edu.ifba.resolution.blocking;

import br.edu.ifba.resolution.core.BlockingExhaustionWarning;
import br.edu.ifba.resolution.core.NormalizedRecord;
import br.edu.ifba.resolution.core.ResolutionSettings;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Groups normalized records into blocks so that only records sharing a block
 * key are compared.
 * 
 * <p>Every configured rule may give a record one key, so a record can sit in
 * several blocks. Records without any key go to the catch-all block, which is
 * bounded by {@code catch-all.max-size}.</p>
 */
@ApplicationScoped
public class Blocker {
    
    private static final Logger logger = LoggerFactory.getLogger(Blocker.class);
    
    /**
     * Reserved key of the catch-all block. Rule keys always start with a rule index.
     */
    public static final String CATCH_ALL = "*";
    
    /**
     * All block keys of a record, one per rule that yields a key.
     */
    @NotNull
    public Set<String> keysFor(@NotNull NormalizedRecord record, @NotNull ResolutionSettings settings) {
        Set<String> keys = new TreeSet<>();
        List<BlockingRule> rules = settings.blockingRules();
        for (int i = 0; i < rules.size(); i++) {
            rules.get(i).keyFor(record, i).ifPresent(keys::add);
        }
        return keys;
    }
    
    /**
     * Assigns records to blocks.
     * 
     * <p>Blocks with a single member generate no pairs and are dropped. The
     * result is independent of input order.</p>
     *
     * @param records normalized records (must not be null)
     * @param settings run settings
     * @return blocks in key order, catch-all last
     */
    @NotNull
    public BlockAssignment assign(@NotNull List<NormalizedRecord> records, @NotNull ResolutionSettings settings) {
        if (records == null) {
            throw new IllegalArgumentException("records cannot be null");
        }
        
        Map<String, List<NormalizedRecord>> byKey = new TreeMap<>();
        List<NormalizedRecord> catchAll = new ArrayList<>();
        
        for (NormalizedRecord record : records) {
            Set<String> keys = keysFor(record, settings);
            if (keys.isEmpty()) {
                catchAll.add(record);
                continue;
            }
            for (String key : keys) {
                byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
            }
        }
        
        Map<String, List<NormalizedRecord>> blocks = new LinkedHashMap<>();
        for (Map.Entry<String, List<NormalizedRecord>> entry : byKey.entrySet()) {
            if (entry.getValue().size() > 1) {
                blocks.put(entry.getKey(), sortedById(entry.getValue()));
            }
        }
        
        BlockingExhaustionWarning warning = null;
        List<NormalizedRecord> catchAllMembers = sortedById(catchAll);
        if (catchAllMembers.size() > settings.catchAllMaxSize()) {
            List<NormalizedRecord> compared = applyOverflow(catchAllMembers, settings);
            warning = new BlockingExhaustionWarning(
                catchAllMembers.size(), settings.catchAllMaxSize(), settings.catchAllOverflow(), compared.size()
            );
            logger.warn(warning.message());
            catchAllMembers = compared;
        }
        if (catchAllMembers.size() > 1) {
            blocks.put(CATCH_ALL, catchAllMembers);
        }
        
        BlockAssignment assignment = new BlockAssignment(blocks, warning);
        logger.debug("Assigned {} records to {} blocks ({} candidate pairs, catch-all={})",
                    records.size(), blocks.size(), assignment.candidatePairCount(), catchAll.size());
        return assignment;
    }
    
    private List<NormalizedRecord> applyOverflow(List<NormalizedRecord> members, ResolutionSettings settings) {
        switch (settings.catchAllOverflow()) {
            case SKIP:
                return List.of();
            case PROCEED:
                return members;
            case SAMPLE:
            default:
                return sample(members, settings.catchAllMaxSize(), settings.seed());
        }
    }
    
    /**
     * Seeded sample of {@code size} records, returned in id order.
     */
    static List<NormalizedRecord> sample(List<NormalizedRecord> members, int size, long seed) {
        List<NormalizedRecord> shuffled = new ArrayList<>(members);
        Random random = new Random(seed);
        // Partial Fisher-Yates over the id-sorted input
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(shuffled.size() - i);
            NormalizedRecord tmp = shuffled.get(i);
            shuffled.set(i, shuffled.get(j));
            shuffled.set(j, tmp);
        }
        return sortedById(shuffled.subList(0, size));
    }
    
    private static List<NormalizedRecord> sortedById(List<NormalizedRecord> records) {
        List<NormalizedRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(NormalizedRecord::id));
        return sorted;
    }
    
    /**
     * Whether two records share at least one block key.
     */
    public boolean shareBlock(@NotNull NormalizedRecord a, @NotNull NormalizedRecord b, @NotNull ResolutionSettings settings) {
        Set<String> keys = keysFor(a, settings);
        Optional<String> shared = keysFor(b, settings).stream().filter(keys::contains).findFirst();
        return shared.isPresent();
    }
}
