package com.adlanda.recommender.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the recommender core.
 *
 * Maps to properties prefixed with 'recommender' in application.properties.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "recommender")
public class RecommenderProperties {

    @Valid
    private final Sync sync = new Sync();

    @Valid
    private final Embedding embedding = new Embedding();

    @Valid
    private final Recommendation recommendation = new Recommendation();

    @Valid
    private final Learning learning = new Learning();

    @Valid
    private final Scheduler scheduler = new Scheduler();

    @Valid
    private final RateLimit rateLimit = new RateLimit();

    private final VectorStore vectorStore = new VectorStore();

    public Sync getSync() {
        return sync;
    }

    public Embedding getEmbedding() {
        return embedding;
    }

    public Recommendation getRecommendation() {
        return recommendation;
    }

    public Learning getLearning() {
        return learning;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public VectorStore getVectorStore() {
        return vectorStore;
    }

    public static class Sync {

        /**
         * Items embedded per provider call.
         */
        @Min(1)
        private int batchSize = 50;

        /**
         * Pause between batches to stay under provider rate limits.
         */
        @NotNull
        private Duration batchDelay = Duration.ofSeconds(1);

        /**
         * Whether to re-embed items whose text changed since they were indexed.
         * When false, only additions and removals are reconciled.
         */
        private boolean detectChanges = true;

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getBatchDelay() {
            return batchDelay;
        }

        public void setBatchDelay(Duration batchDelay) {
            this.batchDelay = batchDelay;
        }

        public boolean isDetectChanges() {
            return detectChanges;
        }

        public void setDetectChanges(boolean detectChanges) {
            this.detectChanges = detectChanges;
        }
    }

    public static class Embedding {

        /**
         * Upper bound for a single provider call.
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        /**
         * Initial backoff before retrying a failed chunk; doubles per attempt.
         */
        @NotNull
        private Duration retryBackoff = Duration.ofMillis(500);

        private final OpenAi openai = new OpenAi();

        private final Cohere cohere = new Cohere();

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }

        public OpenAi getOpenai() {
            return openai;
        }

        public Cohere getCohere() {
            return cohere;
        }

        public static class OpenAi {

            private boolean enabled = true;

            private int maxBatchSize = 2048;

            public boolean isEnabled() {
                return enabled;
            }

            public void setEnabled(boolean enabled) {
                this.enabled = enabled;
            }

            public int getMaxBatchSize() {
                return maxBatchSize;
            }

            public void setMaxBatchSize(int maxBatchSize) {
                this.maxBatchSize = maxBatchSize;
            }
        }

        public static class Cohere {

            /**
             * Leave blank to run without the fallback provider.
             */
            private String apiKey = "";

            private String url = "https://api.cohere.ai/v1/embed";

            private String model = "embed-english-light-v3.0";

            private int maxBatchSize = 96;

            public String getApiKey() {
                return apiKey;
            }

            public void setApiKey(String apiKey) {
                this.apiKey = apiKey;
            }

            public String getUrl() {
                return url;
            }

            public void setUrl(String url) {
                this.url = url;
            }

            public String getModel() {
                return model;
            }

            public void setModel(String model) {
                this.model = model;
            }

            public int getMaxBatchSize() {
                return maxBatchSize;
            }

            public void setMaxBatchSize(int maxBatchSize) {
                this.maxBatchSize = maxBatchSize;
            }
        }
    }

    public static class Recommendation {

        /**
         * Score attached to recent-items fallback results.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double fallbackSimilarity = 0.5;

        /**
         * Minimum similarity for "similar opportunities".
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double similarThreshold = 0.7;

        /**
         * Threshold used by free-text search when the caller gives none.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double defaultSearchThreshold = 0.6;

        public double getFallbackSimilarity() {
            return fallbackSimilarity;
        }

        public void setFallbackSimilarity(double fallbackSimilarity) {
            this.fallbackSimilarity = fallbackSimilarity;
        }

        public double getSimilarThreshold() {
            return similarThreshold;
        }

        public void setSimilarThreshold(double similarThreshold) {
            this.similarThreshold = similarThreshold;
        }

        public double getDefaultSearchThreshold() {
            return defaultSearchThreshold;
        }

        public void setDefaultSearchThreshold(double defaultSearchThreshold) {
            this.defaultSearchThreshold = defaultSearchThreshold;
        }
    }

    public static class Learning {

        /**
         * Maximum unprocessed feedback events consumed per pass.
         */
        @Min(1)
        private int batchLimit = 100;

        /**
         * Trailing window of processed ratings used for the helpful ratio.
         */
        @NotNull
        private Duration window = Duration.ofDays(7);

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double thresholdFloor = 0.6;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double thresholdScale = 0.9;

        /**
         * Ratio assumed while there are no ratings in the window.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double defaultHelpfulRatio = 0.7;

        /**
         * Minimum age of a preference vector before engagement may recompute it.
         */
        @NotNull
        private Duration preferenceRefreshInterval = Duration.ofHours(6);

        /**
         * Weighted categories appended to the preference text.
         */
        @Min(1)
        private int topCategories = 5;

        /**
         * Processed feedback older than this is purged by the daily cleanup.
         */
        @NotNull
        private Duration processedRetention = Duration.ofDays(30);

        public int getBatchLimit() {
            return batchLimit;
        }

        public void setBatchLimit(int batchLimit) {
            this.batchLimit = batchLimit;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public double getThresholdFloor() {
            return thresholdFloor;
        }

        public void setThresholdFloor(double thresholdFloor) {
            this.thresholdFloor = thresholdFloor;
        }

        public double getThresholdScale() {
            return thresholdScale;
        }

        public void setThresholdScale(double thresholdScale) {
            this.thresholdScale = thresholdScale;
        }

        public double getDefaultHelpfulRatio() {
            return defaultHelpfulRatio;
        }

        public void setDefaultHelpfulRatio(double defaultHelpfulRatio) {
            this.defaultHelpfulRatio = defaultHelpfulRatio;
        }

        public Duration getPreferenceRefreshInterval() {
            return preferenceRefreshInterval;
        }

        public void setPreferenceRefreshInterval(Duration preferenceRefreshInterval) {
            this.preferenceRefreshInterval = preferenceRefreshInterval;
        }

        public int getTopCategories() {
            return topCategories;
        }

        public void setTopCategories(int topCategories) {
            this.topCategories = topCategories;
        }

        public Duration getProcessedRetention() {
            return processedRetention;
        }

        public void setProcessedRetention(Duration processedRetention) {
            this.processedRetention = processedRetention;
        }
    }

    public static class Scheduler {

        /**
         * Start the recurring tasks when the application is ready.
         */
        private boolean autoStart = true;

        /**
         * Maximum time a manual run may block its caller.
         */
        @NotNull
        private Duration runNowTimeout = Duration.ofMinutes(10);

        /**
         * Delay before the first sync after start; other tasks wait one interval.
         */
        @NotNull
        private Duration initialSyncDelay = Duration.ofSeconds(30);

        @NotNull
        private Duration embeddingSync = Duration.ofHours(1);

        @NotNull
        private Duration maintenance = Duration.ofHours(6);

        @NotNull
        private Duration statsCollection = Duration.ofMinutes(30);

        @NotNull
        private Duration dailyCleanup = Duration.ofHours(24);

        @NotNull
        private Duration learningLoop = Duration.ofHours(24);

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public Duration getRunNowTimeout() {
            return runNowTimeout;
        }

        public void setRunNowTimeout(Duration runNowTimeout) {
            this.runNowTimeout = runNowTimeout;
        }

        public Duration getInitialSyncDelay() {
            return initialSyncDelay;
        }

        public void setInitialSyncDelay(Duration initialSyncDelay) {
            this.initialSyncDelay = initialSyncDelay;
        }

        public Duration getEmbeddingSync() {
            return embeddingSync;
        }

        public void setEmbeddingSync(Duration embeddingSync) {
            this.embeddingSync = embeddingSync;
        }

        public Duration getMaintenance() {
            return maintenance;
        }

        public void setMaintenance(Duration maintenance) {
            this.maintenance = maintenance;
        }

        public Duration getStatsCollection() {
            return statsCollection;
        }

        public void setStatsCollection(Duration statsCollection) {
            this.statsCollection = statsCollection;
        }

        public Duration getDailyCleanup() {
            return dailyCleanup;
        }

        public void setDailyCleanup(Duration dailyCleanup) {
            this.dailyCleanup = dailyCleanup;
        }

        public Duration getLearningLoop() {
            return learningLoop;
        }

        public void setLearningLoop(Duration learningLoop) {
            this.learningLoop = learningLoop;
        }
    }

    public static class RateLimit {

        @Min(1)
        private int requestsPerWindow = 60;

        @NotNull
        private Duration window = Duration.ofMinutes(1);

        /**
         * Upper bound on users tracked at once; least recently seen are evicted.
         */
        @Min(1)
        private long maxTrackedUsers = 10_000;

        public int getRequestsPerWindow() {
            return requestsPerWindow;
        }

        public void setRequestsPerWindow(int requestsPerWindow) {
            this.requestsPerWindow = requestsPerWindow;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public long getMaxTrackedUsers() {
            return maxTrackedUsers;
        }

        public void setMaxTrackedUsers(long maxTrackedUsers) {
            this.maxTrackedUsers = maxTrackedUsers;
        }
    }

    public static class VectorStore {

        /**
         * Backing index: "pgvector" or "memory".
         */
        private String type = "pgvector";

        /**
         * Create the pgvector extension and embeddings table at startup.
         */
        private boolean initializeSchema = true;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public boolean isInitializeSchema() {
            return initializeSchema;
        }

        public void setInitializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
        }
    }
}
