package com.purchasingpower.reviewflow.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tuning knobs of the review engine, bound from {@code app.review}.
 *
 * <pre>
 * app:
 *   review:
 *     deadline: 120s
 *     retrieval:
 *       provider: none
 *       top-k: 8
 *     aggregation:
 *       confidence-cap: 0.95
 *     learning:
 *       learning-rate: 0.1
 *       confidence-floor: 0.1
 * </pre>
 *
 * <p>Bound once at startup; nothing here changes while the service runs.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.review")
public class ReviewEngineProperties {

    /**
     * Overall wall-clock limit for one review, after which it fails with TIMEOUT.
     */
    @NotNull
    private Duration deadline = Duration.ofMinutes(2);

    @Valid
    private Retrieval retrieval = new Retrieval();

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Budget budget = new Budget();

    @Valid
    private Aggregation aggregation = new Aggregation();

    @Valid
    private Learning learning = new Learning();

    @Valid
    private Concurrency concurrency = new Concurrency();

    @Data
    public static class Retrieval {
        /** "pinecone" or "none". */
        private String provider = "none";

        @Min(1)
        private int topK = 8;

        @NotNull
        private Duration timeout = Duration.ofSeconds(3);

        /** Immediate retries after an explicit "unavailable" answer. Never applied after a timeout. */
        @Min(0)
        private int unavailableRetries = 1;

        @Min(3)
        private int maxChunkLines = 40;

        @Min(1)
        private int maxQueryChunks = 10;
    }

    @Data
    public static class Cache {
        @NotNull
        private Duration ttl = Duration.ofDays(90);

        @Min(1000)
        private long purgeIntervalMs = 600_000;
    }

    @Data
    public static class Budget {
        /** Maximum model spend for one review, in USD. */
        @DecimalMin("0.0")
        private double maxCostPerReview = 0.05;

        /** Cap on provider attempts (first tries plus fallbacks) for one review. */
        @Min(0)
        private int maxProviderAttempts = 4;
    }

    @Data
    public static class Aggregation {
        @Min(0)
        private int lineTolerance = 3;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double similarityThreshold = 0.3;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double confidenceCap = 0.95;
    }

    @Data
    public static class Learning {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double learningRate = 0.1;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double confidenceFloor = 0.1;

        @Min(1)
        private int velocityWindow = 10;

        @Min(1)
        private int calibrationBuckets = 10;

        @Min(1000)
        private long recomputeIntervalMs = 300_000;

        /** Replay persisted feedback into the weight table on startup. */
        private boolean replayOnStartup = true;
    }

    @Data
    public static class Concurrency {
        @Min(1)
        private int reviewThreads = 4;

        @Min(1)
        private int analysisThreads = 8;

        @Min(1)
        private int providerThreads = 8;

        @Min(0)
        private int queueCapacity = 100;
    }
}
