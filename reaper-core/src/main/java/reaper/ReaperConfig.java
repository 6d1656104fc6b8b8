package reaper;

import java.time.Duration;

/**
 * Immutable tuning knobs for one reaper. Passed explicitly into every selector,
 * worker, refresher and committer call rather than read from global state.
 *
 * <p>Create instances via {@link #builder()} or use {@link #defaults()}.
 *
 * @see ReaperConfig.Builder
 */
public final class ReaperConfig {
    public static final boolean DEFAULT_IMMEDIATE_CLEANUP = false;
    public static final int DEFAULT_DB_BATCH_SIZE = 50;
    public static final int DEFAULT_REFRESH_TRIGGER_RATIO = 80;
    public static final long DEFAULT_DELAY_SECONDS = 600;
    public static final int DEFAULT_CHUNK_SIZE = 100;

    private static final ReaperConfig DEFAULTS = builder().build();

    private final boolean immediateCleanup;
    private final int dbBatchSize;
    private final int refreshTriggerRatio;
    private final long delaySeconds;
    private final int chunkSize;
    private final int deletionChunkSize;

    private ReaperConfig(Builder builder) {
        if (builder.dbBatchSize <= 0) {
            throw new IllegalArgumentException("dbBatchSize must be > 0");
        }
        if (builder.refreshTriggerRatio <= 0 || builder.refreshTriggerRatio > 100) {
            throw new IllegalArgumentException("refreshTriggerRatio must be in 1..100");
        }
        if (builder.delaySeconds <= 0L) {
            throw new IllegalArgumentException("delaySeconds must be > 0");
        }
        if (builder.chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        if (builder.deletionChunkSize < 0) {
            throw new IllegalArgumentException("deletionChunkSize must be >= 0");
        }
        this.immediateCleanup = builder.immediateCleanup;
        this.dbBatchSize = builder.dbBatchSize;
        this.refreshTriggerRatio = builder.refreshTriggerRatio;
        this.delaySeconds = builder.delaySeconds;
        this.chunkSize = builder.chunkSize;
        this.deletionChunkSize = builder.deletionChunkSize == 0 ? builder.chunkSize : builder.deletionChunkSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ReaperConfig defaults() {
        return DEFAULTS;
    }

    /** Whether successes are removed from the catalog while the batch is processed. */
    public boolean immediateCleanup() {
        return immediateCleanup;
    }

    public int dbBatchSize() {
        return dbBatchSize;
    }

    /** Percentage of {@link #delaySeconds()} after which outstanding leases are refreshed. */
    public int refreshTriggerRatio() {
        return refreshTriggerRatio;
    }

    public long delaySeconds() {
        return delaySeconds;
    }

    public int chunkSize() {
        return chunkSize;
    }

    /** Sub-chunk size used by the worker between refresh checks. */
    public int deletionChunkSize() {
        return deletionChunkSize;
    }

    /** Lease duration; a row stamped longer ago than this may be claimed again. */
    public Duration leaseDuration() {
        return Duration.ofSeconds(delaySeconds);
    }

    /** Lease age beyond which the refresher re-stamps outstanding rows. */
    public Duration refreshTriggerTime() {
        return Duration.ofMillis(delaySeconds * 1000L * refreshTriggerRatio / 100L);
    }

    public String mode() {
        return immediateCleanup ? "immediate" : "deferred";
    }

    public Builder toBuilder() {
        return new Builder()
                .immediateCleanup(immediateCleanup)
                .dbBatchSize(dbBatchSize)
                .refreshTriggerRatio(refreshTriggerRatio)
                .delaySeconds(delaySeconds)
                .chunkSize(chunkSize)
                .deletionChunkSize(deletionChunkSize == chunkSize ? 0 : deletionChunkSize);
    }

    @Override
    public String toString() {
        return "{enable_immediate_cleanup=" + immediateCleanup +
                ", db_batch_size=" + dbBatchSize +
                ", refresh_trigger_ratio=" + refreshTriggerRatio +
                ", delay_seconds=" + delaySeconds +
                ", chunk_size=" + chunkSize +
                ", deletion_chunk_size=" + deletionChunkSize + "}";
    }

    /**
     * Builder for {@link ReaperConfig}.
     */
    public static final class Builder {
        private boolean immediateCleanup = DEFAULT_IMMEDIATE_CLEANUP;
        private int dbBatchSize = DEFAULT_DB_BATCH_SIZE;
        private int refreshTriggerRatio = DEFAULT_REFRESH_TRIGGER_RATIO;
        private long delaySeconds = DEFAULT_DELAY_SECONDS;
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private int deletionChunkSize;

        private Builder() {
        }

        /**
         * Selects the cleanup committer. When {@code true}, succeeded replicas are removed
         * from the catalog in slices of {@link #dbBatchSize} while the batch is processed;
         * otherwise they are handed back to the caller at the end.
         *
         * <p>Optional. Defaults to {@code false}.
         *
         * @param immediateCleanup whether to commit incrementally
         * @return this builder
         */
        public Builder immediateCleanup(boolean immediateCleanup) {
            this.immediateCleanup = immediateCleanup;
            return this;
        }

        /**
         * Sets the number of rows removed from the catalog per delete.
         *
         * <p>Optional. Defaults to {@code 50}. Must be &gt; 0.
         *
         * @param dbBatchSize rows per catalog delete
         * @return this builder
         */
        public Builder dbBatchSize(int dbBatchSize) {
            this.dbBatchSize = dbBatchSize;
            return this;
        }

        /**
         * Sets the percentage of the lease duration after which outstanding leases are refreshed.
         *
         * <p>Optional. Defaults to {@code 80}. Must be in {@code 1..100}.
         *
         * @param refreshTriggerRatio percentage of {@code delaySeconds}
         * @return this builder
         */
        public Builder refreshTriggerRatio(int refreshTriggerRatio) {
            this.refreshTriggerRatio = refreshTriggerRatio;
            return this;
        }

        /**
         * Sets the lease duration, which is also the re-claim threshold.
         *
         * <p>Optional. Defaults to {@code 600}. Must be &gt; 0.
         *
         * @param delaySeconds lease duration in seconds
         * @return this builder
         */
        public Builder delaySeconds(long delaySeconds) {
            this.delaySeconds = delaySeconds;
            return this;
        }

        /**
         * Sets the maximum number of replicas claimed per batch.
         *
         * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
         *
         * @param chunkSize replicas per claim
         * @return this builder
         */
        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        /**
         * Sets the number of replicas deleted between two refresh checks.
         *
         * <p>Optional. {@code 0} (the default) reuses {@link #chunkSize}.
         *
         * @param deletionChunkSize replicas per worker sub-chunk
         * @return this builder
         */
        public Builder deletionChunkSize(int deletionChunkSize) {
            this.deletionChunkSize = deletionChunkSize;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return a new {@link ReaperConfig}
         * @throws IllegalArgumentException if any value is out of range
         */
        public ReaperConfig build() {
            return new ReaperConfig(this);
        }
    }
}
