package br.edu.ifba.resolution.core;

import br.edu.ifba.exception.ConfigurationException;
import br.edu.ifba.exception.MalformedRecordException;
import br.edu.ifba.resolution.blocking.BlockAssignment;
import br.edu.ifba.resolution.blocking.Blocker;
import br.edu.ifba.resolution.cluster.ClusterExtractor;
import br.edu.ifba.resolution.cluster.Clustering;
import br.edu.ifba.resolution.graph.SimilarityEdge;
import br.edu.ifba.resolution.graph.SimilarityGraph;
import br.edu.ifba.resolution.merge.MasterEntity;
import br.edu.ifba.resolution.merge.MasterEntityBuilder;
import br.edu.ifba.resolution.merge.Resolution;
import br.edu.ifba.resolution.merge.ResolutionStrategyFactory;
import br.edu.ifba.resolution.similarity.PairScorer;
import br.edu.ifba.resolution.storage.RecordSource;
import br.edu.ifba.resolution.storage.ResolutionSink;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs entity resolution over one batch of records.
 * 
 * <p>Pipeline:</p>
 * <ol>
 *   <li>Validate ids; malformed records are rejected and the run continues</li>
 *   <li>Normalize typed fields (parallel, in batches)</li>
 *   <li>Assign block keys</li>
 *   <li>Score candidate pairs inside each block (parallel) and merge the edges
 *       into the similarity graph on the calling thread, in block order</li>
 *   <li>Seal the graph and extract clusters</li>
 *   <li>Build master entities and apply the merge or link strategy</li>
 * </ol>
 * 
 * <p>The engine keeps no state between runs. Settings are resolved once per
 * run and passed explicitly to every stage.</p>
 */
@ApplicationScoped
public class ResolutionEngine {
    
    private static final Logger logger = LoggerFactory.getLogger(ResolutionEngine.class);
    
    private final ResolutionConfig config;
    private final RecordNormalizer normalizer;
    private final Blocker blocker;
    private final PairScorer scorer;
    private final ClusterExtractor extractor;
    private final MasterEntityBuilder masterBuilder;
    private final ResolutionStrategyFactory strategyFactory;
    
    @Inject
    public ResolutionEngine(
            ResolutionConfig config,
            RecordNormalizer normalizer,
            Blocker blocker,
            PairScorer scorer,
            ClusterExtractor extractor,
            MasterEntityBuilder masterBuilder,
            ResolutionStrategyFactory strategyFactory) {
        this.config = config;
        this.normalizer = normalizer;
        this.blocker = blocker;
        this.scorer = scorer;
        this.extractor = extractor;
        this.masterBuilder = masterBuilder;
        this.strategyFactory = strategyFactory;
    }
    
    /**
     * Settings of the application configuration.
     *
     * @throws ConfigurationException if the configuration is missing or invalid
     */
    @NotNull
    public ResolutionSettings settings() {
        if (config == null) {
            throw new ConfigurationException("No resolution configuration available");
        }
        return ResolutionSettings.from(config);
    }
    
    /**
     * Loads records from the source, resolves them with the application
     * configuration and writes every output to the sink.
     */
    @NotNull
    public ResolutionResult run(@NotNull RecordSource source, @NotNull ResolutionSink sink) {
        return run(source, sink, settings());
    }
    
    /**
     * Loads records from the source, resolves them and writes every output to the sink.
     *
     * @param source record source
     * @param sink output sink, called synchronously in pipeline order
     * @param settings run settings
     * @return the run result
     */
    @NotNull
    public ResolutionResult run(@NotNull RecordSource source, @NotNull ResolutionSink sink, @NotNull ResolutionSettings settings) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        
        List<Record> records = source.loadRecords();
        ResolutionResult result = resolve(records, settings);
        
        Instant writeStart = Instant.now();
        if (settings.persistNormalized()) {
            for (NormalizedRecord record : result.normalizedRecords()) {
                record.values().forEach((field, value) -> sink.writeNormalized(record.id(), field, value.normalized()));
            }
        }
        sink.writeEdges(result.edges());
        sink.writeClusters(result.clustering().assignments());
        sink.writeMasterEntities(result.masters());
        sink.writeAssignments(result.assignments());
        sink.writeResolution(result.resolution());
        
        logger.debug("Wrote run outputs to sink in {}ms", Duration.between(writeStart, Instant.now()).toMillis());
        return result;
    }
    
    /**
     * Resolves a batch of records.
     *
     * @param records raw records (must not be null)
     * @param settings run settings
     * @return the run result
     * @throws br.edu.ifba.exception.ClusteringNondeterminismException in verification mode when partitions disagree
     */
    @NotNull
    public ResolutionResult resolve(@NotNull List<Record> records, @NotNull ResolutionSettings settings) {
        if (records == null) {
            throw new IllegalArgumentException("records cannot be null");
        }
        if (settings == null) {
            throw new ConfigurationException("settings cannot be null");
        }
        
        Instant overallStart = Instant.now();
        logger.info("Resolving {} records ({})", records.size(), settings.toLogString());
        
        // Step 1: Validate ids
        List<RecordRejection> rejections = new ArrayList<>();
        List<Record> accepted = accept(records, rejections);
        
        SimilarityGraph graph = new SimilarityGraph();
        List<NormalizedRecord> normalized;
        BlockAssignment blocks;
        long normalizationMs;
        long blockingMs;
        long scoringMs;
        
        ExecutorService executor = Executors.newFixedThreadPool(settings.threads());
        try {
            // Step 2: Normalize
            Instant normalizationStart = Instant.now();
            normalized = normalizeAll(accepted, settings, executor);
            normalized.forEach(graph::addNode);
            normalizationMs = Duration.between(normalizationStart, Instant.now()).toMillis();
            logger.debug("Normalized {} records in {}ms", normalized.size(), normalizationMs);
            
            // Step 3: Block
            Instant blockingStart = Instant.now();
            blocks = blocker.assign(normalized, settings);
            blockingMs = Duration.between(blockingStart, Instant.now()).toMillis();
            logger.debug("Built {} blocks ({} candidate pairs) in {}ms",
                        blocks.blocks().size(), blocks.candidatePairCount(), blockingMs);
            
            // Step 4: Score
            Instant scoringStart = Instant.now();
            scoreAll(blocks, graph, settings, executor);
            scoringMs = Duration.between(scoringStart, Instant.now()).toMillis();
            logger.debug("Scored blocks into {} edges in {}ms", graph.edgeCount(), scoringMs);
        } finally {
            executor.shutdown();
        }
        
        // Step 5: Cluster
        Instant clusteringStart = Instant.now();
        Clustering clustering = extractor.extract(graph, settings);
        long clusteringMs = Duration.between(clusteringStart, Instant.now()).toMillis();
        logger.debug("Extracted {} clusters with {} in {}ms",
                    clustering.clusters().size(), clustering.algorithm(), clusteringMs);
        
        // Step 6: Masters and strategy
        Instant resolutionStart = Instant.now();
        Map<String, NormalizedRecord> recordsById = new LinkedHashMap<>();
        normalized.forEach(record -> recordsById.put(record.id(), record));
        Map<Integer, MasterEntity> masters = masterBuilder.buildAll(clustering.clusters(), recordsById);
        Resolution resolution = strategyFactory.getStrategy(settings.mode()).resolve(normalized, clustering, masters);
        long resolutionMs = Duration.between(resolutionStart, Instant.now()).toMillis();
        
        List<BlockingExhaustionWarning> warnings = new ArrayList<>();
        blocks.exhaustionWarning().ifPresent(warnings::add);
        
        RunStatistics statistics = new RunStatistics(
            records.size(), normalized.size(), blocks.blocks().size(), blocks.candidatePairCount(),
            graph.edgeCount(), clustering.clusters().size(), clustering.singletons().size(),
            normalizationMs, blockingMs, scoringMs, clusteringMs, resolutionMs
        );
        
        ResolutionResult result = new ResolutionResult(
            normalized,
            graph.allEdges(),
            clustering,
            new ArrayList<>(masters.values()),
            MasterEntityBuilder.assignments(masters),
            resolution,
            rejections,
            warnings,
            statistics
        );
        
        long overallMs = Duration.between(overallStart, Instant.now()).toMillis();
        logger.info("Resolution complete in {}ms: {} (normalize={}ms, block={}ms, score={}ms, cluster={}ms, resolve={}ms)",
                   overallMs, result.toLogString(), normalizationMs, blockingMs, scoringMs, clusteringMs, resolutionMs);
        
        return result;
    }
    
    /**
     * Keeps records with a present, unique id, in id order.
     */
    private List<Record> accept(List<Record> records, List<RecordRejection> rejections) {
        Set<String> seen = new HashSet<>();
        List<Record> accepted = new ArrayList<>(records.size());
        
        for (Record record : records) {
            try {
                validate(record, seen);
                accepted.add(record);
            } catch (MalformedRecordException e) {
                logger.warn("Rejected record {}: {}", e.getRecordId(), e.getMessage());
                rejections.add(new RecordRejection(e.getRecordId(), e.getMessage()));
            }
        }
        
        accepted.sort(Comparator.comparing(Record::id));
        return accepted;
    }
    
    private void validate(Record record, Set<String> seen) {
        if (record == null) {
            throw new MalformedRecordException(null, "Record is null");
        }
        if (record.id() == null || record.id().isBlank()) {
            throw new MalformedRecordException(record.id(), "Record has no id");
        }
        if (record.id().indexOf('\u0000') >= 0) {
            throw new MalformedRecordException(record.id(), "Record id contains a NUL character");
        }
        if (!seen.add(record.id())) {
            throw new MalformedRecordException(record.id(), "Duplicate record id '" + record.id() + "'");
        }
    }
    
    private List<NormalizedRecord> normalizeAll(List<Record> records, ResolutionSettings settings, ExecutorService executor) {
        int batchSize = settings.batchSize();
        List<CompletableFuture<List<NormalizedRecord>>> futures = new ArrayList<>();
        
        for (int start = 0; start < records.size(); start += batchSize) {
            List<Record> batch = records.subList(start, Math.min(start + batchSize, records.size()));
            futures.add(CompletableFuture.supplyAsync(() -> {
                List<NormalizedRecord> out = new ArrayList<>(batch.size());
                for (Record record : batch) {
                    out.add(normalizer.normalize(record, settings));
                }
                return out;
            }, executor));
        }
        
        List<NormalizedRecord> normalized = new ArrayList<>(records.size());
        for (List<NormalizedRecord> batch : joinAll(futures)) {
            normalized.addAll(batch);
        }
        return normalized;
    }
    
    /**
     * Scores every block on the pool; edges are merged into the graph here, in
     * block order, so the graph has a single writer.
     */
    private void scoreAll(BlockAssignment blocks, SimilarityGraph graph, ResolutionSettings settings, ExecutorService executor) {
        int batchSize = settings.batchSize();
        List<CompletableFuture<List<SimilarityEdge>>> futures = new ArrayList<>();
        
        for (List<NormalizedRecord> block : blocks.blocks().values()) {
            // Large blocks are split by rows so one block does not occupy a single worker
            for (int fromRow = 0; fromRow < block.size() - 1; fromRow += batchSize) {
                int from = fromRow;
                int to = Math.min(fromRow + batchSize, block.size());
                futures.add(CompletableFuture.supplyAsync(() -> scorer.scoreRows(block, from, to, settings), executor));
            }
        }
        
        for (List<SimilarityEdge> edges : joinAll(futures)) {
            graph.addEdges(edges);
        }
    }
    
    /**
     * Waits for every task and returns the results in submission order.
     */
    private static <T> List<T> joinAll(List<CompletableFuture<T>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
        
        List<T> results = new ArrayList<>(futures.size());
        for (CompletableFuture<T> future : futures) {
            results.add(future.join());
        }
        return results;
    }
}
