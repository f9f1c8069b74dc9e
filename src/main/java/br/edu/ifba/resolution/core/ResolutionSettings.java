package br.edu.ifba.resolution.core;

import br.edu.ifba.exception.ConfigurationException;
import br.edu.ifba.resolution.blocking.BlockingRule;
import br.edu.ifba.resolution.blocking.CatchAllOverflow;
import br.edu.ifba.resolution.cluster.LouvainCommunityDetection;
import br.edu.ifba.resolution.merge.ResolutionMode;
import br.edu.ifba.resolution.similarity.FieldScoring;
import br.edu.ifba.resolution.similarity.MissingFieldPolicy;
import br.edu.ifba.resolution.similarity.SimilarityMetric;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Validated, immutable settings for one resolution run.
 *
 * <p>Built once per run, either from {@link ResolutionConfig} or through the
 * {@link Builder}, and passed to every component. Invalid settings fail with a
 * {@link ConfigurationException} before any record is processed.</p>
 */
public record ResolutionSettings(
    ResolutionMode mode,
    List<BlockingRule> blockingRules,
    int catchAllMaxSize,
    CatchAllOverflow catchAllOverflow,
    Map<FieldType, FieldScoring> fieldScoring,
    MissingFieldPolicy missingFieldPolicy,
    double lowThreshold,
    double highThreshold,
    String algorithm,
    long seed,
    double modularityResolution,
    int verificationRuns,
    boolean singletonPromotion,
    String phoneCountryCode,
    int phoneNationalLength,
    boolean persistNormalized,
    int threads,
    int batchSize
) {

    /**
     * Tolerance when checking that field weights sum to 1.0.
     */
    public static final double WEIGHT_SUM_TOLERANCE = 1e-6;

    public ResolutionSettings {
        blockingRules = List.copyOf(blockingRules);
        EnumMap<FieldType, FieldScoring> scoring = new EnumMap<>(FieldType.class);
        scoring.putAll(fieldScoring);
        fieldScoring = Collections.unmodifiableMap(scoring);
    }

    /**
     * Builds and validates settings from the application configuration.
     *
     * @param config mapped configuration
     * @return validated settings
     * @throws ConfigurationException if the configuration is invalid
     */
    @NotNull
    public static ResolutionSettings from(@NotNull ResolutionConfig config) {
        Builder builder = builder()
            .mode(config.mode().orElse(null))
            .catchAllMaxSize(config.blocking().catchAll().maxSize())
            .catchAllOverflow(config.blocking().catchAll().overflow())
            .missingFieldPolicy(config.scoring().missingFields())
            .lowThreshold(config.thresholds().low())
            .highThreshold(config.thresholds().high())
            .algorithm(config.clustering().algorithm())
            .seed(config.clustering().seed())
            .modularityResolution(config.clustering().resolution())
            .verificationRuns(config.clustering().verificationRuns())
            .singletonPromotion(config.singletonPromotion())
            .phoneCountryCode(config.normalization().phone().countryCode().orElse(""))
            .phoneNationalLength(config.normalization().phone().nationalLength())
            .persistNormalized(config.normalization().persist())
            .threads(config.parallel().threads())
            .batchSize(config.parallel().batchSize());

        for (String rule : config.blocking().rules()) {
            builder.blockingRule(rule);
        }
        for (Map.Entry<String, ResolutionConfig.Scoring.Field> entry : config.scoring().fields().entrySet()) {
            builder.field(entry.getKey(), entry.getValue().metric(), entry.getValue().weight());
        }

        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy of these settings with a different mode.
     */
    public ResolutionSettings withMode(@NotNull ResolutionMode newMode) {
        return new ResolutionSettings(
            newMode, blockingRules, catchAllMaxSize, catchAllOverflow, fieldScoring, missingFieldPolicy,
            lowThreshold, highThreshold, algorithm, seed, modularityResolution, verificationRuns,
            singletonPromotion, phoneCountryCode, phoneNationalLength, persistNormalized, threads, batchSize
        );
    }

    /**
     * Copy of these settings with singleton promotion switched.
     */
    public ResolutionSettings withSingletonPromotion(boolean promote) {
        return new ResolutionSettings(
            mode, blockingRules, catchAllMaxSize, catchAllOverflow, fieldScoring, missingFieldPolicy,
            lowThreshold, highThreshold, algorithm, seed, modularityResolution, verificationRuns,
            promote, phoneCountryCode, phoneNationalLength, persistNormalized, threads, batchSize
        );
    }

    /**
     * Returns a formatted string representation for logging.
     */
    public String toLogString() {
        return String.format(
            "mode=%s, rules=%s, low=%.2f, high=%.2f, algorithm=%s, seed=%d, threads=%d",
            mode, blockingRules, lowThreshold, highThreshold, algorithm, seed, threads
        );
    }

    /**
     * Collects raw settings and validates them on {@link #build()}.
     * Textual values (mode, metric names, field keys, rules) are parsed at build
     * time so that every problem surfaces as a {@link ConfigurationException}.
     */
    public static class Builder {
        private String mode;
        private final List<String> blockingRules = new ArrayList<>();
        private int catchAllMaxSize = 1000;
        private String catchAllOverflow = CatchAllOverflow.SAMPLE.name();
        private final Map<String, String> fieldMetrics = new LinkedHashMap<>();
        private final Map<String, Double> fieldWeights = new LinkedHashMap<>();
        private String missingFieldPolicy = MissingFieldPolicy.IGNORE.name();
        private Double lowThreshold;
        private Double highThreshold;
        private String algorithm = "louvain";
        private Long seed;
        private double modularityResolution = LouvainCommunityDetection.DEFAULT_RESOLUTION;
        private int verificationRuns = 0;
        private boolean singletonPromotion = false;
        private String phoneCountryCode = "1";
        private int phoneNationalLength = 10;
        private boolean persistNormalized = false;
        private int threads = 4;
        private int batchSize = 200;

        public Builder mode(String mode) {
            this.mode = mode;
            return this;
        }

        public Builder mode(@NotNull ResolutionMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode must not be null").name();
            return this;
        }

        public Builder blockingRule(@NotNull String rule) {
            this.blockingRules.add(Objects.requireNonNull(rule, "rule must not be null"));
            return this;
        }

        public Builder catchAllMaxSize(int catchAllMaxSize) {
            this.catchAllMaxSize = catchAllMaxSize;
            return this;
        }

        public Builder catchAllOverflow(String catchAllOverflow) {
            this.catchAllOverflow = catchAllOverflow;
            return this;
        }

        public Builder catchAllOverflow(@NotNull CatchAllOverflow catchAllOverflow) {
            this.catchAllOverflow = catchAllOverflow.name();
            return this;
        }

        public Builder field(@NotNull String field, String metric, double weight) {
            this.fieldMetrics.put(Objects.requireNonNull(field, "field must not be null"), metric);
            this.fieldWeights.put(field, weight);
            return this;
        }

        public Builder field(@NotNull FieldType field, @NotNull SimilarityMetric metric, double weight) {
            return field(field.key(), metric.configName(), weight);
        }

        public Builder missingFieldPolicy(String missingFieldPolicy) {
            this.missingFieldPolicy = missingFieldPolicy;
            return this;
        }

        public Builder missingFieldPolicy(@NotNull MissingFieldPolicy missingFieldPolicy) {
            this.missingFieldPolicy = missingFieldPolicy.name();
            return this;
        }

        public Builder lowThreshold(double lowThreshold) {
            this.lowThreshold = lowThreshold;
            return this;
        }

        public Builder highThreshold(double highThreshold) {
            this.highThreshold = highThreshold;
            return this;
        }

        public Builder algorithm(@NotNull String algorithm) {
            this.algorithm = Objects.requireNonNull(algorithm, "algorithm must not be null");
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder modularityResolution(double modularityResolution) {
            this.modularityResolution = modularityResolution;
            return this;
        }

        public Builder verificationRuns(int verificationRuns) {
            this.verificationRuns = verificationRuns;
            return this;
        }

        public Builder singletonPromotion(boolean singletonPromotion) {
            this.singletonPromotion = singletonPromotion;
            return this;
        }

        public Builder phoneCountryCode(String phoneCountryCode) {
            this.phoneCountryCode = phoneCountryCode;
            return this;
        }

        public Builder phoneNationalLength(int phoneNationalLength) {
            this.phoneNationalLength = phoneNationalLength;
            return this;
        }

        public Builder persistNormalized(boolean persistNormalized) {
            this.persistNormalized = persistNormalized;
            return this;
        }

        public Builder threads(int threads) {
            this.threads = threads;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Validates and builds the settings.
         *
         * @throws ConfigurationException on the first invalid value
         */
        public ResolutionSettings build() {
            ResolutionMode parsedMode = parse(() -> ResolutionMode.fromString(mode));

            List<BlockingRule> rules = new ArrayList<>();
            for (String rule : blockingRules) {
                rules.add(parse(() -> BlockingRule.parse(rule)));
            }

            Map<FieldType, FieldScoring> scoring = new EnumMap<>(FieldType.class);
            double weightSum = 0.0;
            for (Map.Entry<String, String> entry : fieldMetrics.entrySet()) {
                FieldType type = parse(() -> FieldType.fromKey(entry.getKey()));
                SimilarityMetric metric = parse(() -> SimilarityMetric.fromName(entry.getValue()));
                double weight = fieldWeights.get(entry.getKey());
                if (weight < 0.0 || weight > 1.0) {
                    throw new ConfigurationException(
                        String.format("Weight of field '%s' must be in [0.0, 1.0], got %.3f", entry.getKey(), weight)
                    );
                }
                if (scoring.put(type, new FieldScoring(metric, weight)) != null) {
                    throw new ConfigurationException("Field '" + entry.getKey() + "' is configured twice");
                }
                weightSum += weight;
            }
            if (scoring.isEmpty()) {
                throw new ConfigurationException("At least one scoring field must be configured");
            }
            if (Math.abs(weightSum - 1.0) > WEIGHT_SUM_TOLERANCE) {
                throw new ConfigurationException(
                    String.format("Similarity weights must sum to 1.0, got %.3f (%s)", weightSum, fieldWeights)
                );
            }

            if (lowThreshold == null || highThreshold == null) {
                throw new ConfigurationException("Both low and high thresholds must be set");
            }
            checkUnitInterval("low threshold", lowThreshold);
            checkUnitInterval("high threshold", highThreshold);
            if (lowThreshold > highThreshold) {
                throw new ConfigurationException(
                    String.format("Low threshold %.3f cannot exceed high threshold %.3f", lowThreshold, highThreshold)
                );
            }
            if (seed == null) {
                throw new ConfigurationException("Clustering seed must be set");
            }
            if (algorithm.isBlank()) {
                throw new ConfigurationException("Clustering algorithm cannot be blank");
            }
            if (modularityResolution <= 0.0) {
                throw new ConfigurationException("Modularity resolution must be positive, got " + modularityResolution);
            }
            checkPositive("catch-all max size", catchAllMaxSize);
            checkPositive("phone national length", phoneNationalLength);
            checkPositive("threads", threads);
            checkPositive("batch size", batchSize);
            if (verificationRuns < 0) {
                throw new ConfigurationException("Verification runs cannot be negative, got " + verificationRuns);
            }

            return new ResolutionSettings(
                parsedMode,
                rules,
                catchAllMaxSize,
                parse(() -> CatchAllOverflow.fromString(catchAllOverflow)),
                scoring,
                parse(() -> MissingFieldPolicy.fromString(missingFieldPolicy)),
                lowThreshold,
                highThreshold,
                algorithm.trim().toLowerCase(Locale.ROOT),
                seed,
                modularityResolution,
                verificationRuns,
                singletonPromotion,
                phoneCountryCode != null ? phoneCountryCode.trim() : "",
                phoneNationalLength,
                persistNormalized,
                threads,
                batchSize
            );
        }

        private static <T> T parse(Supplier<T> parser) {
            try {
                return parser.get();
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(e.getMessage(), e);
            }
        }

        private static void checkUnitInterval(String name, double value) {
            if (value < 0.0 || value > 1.0) {
                throw new ConfigurationException(String.format("The %s must be in [0.0, 1.0], got %.3f", name, value));
            }
        }

        private static void checkPositive(String name, int value) {
            if (value <= 0) {
                throw new ConfigurationException("The " + name + " must be positive, got " + value);
            }
        }
    }
}
