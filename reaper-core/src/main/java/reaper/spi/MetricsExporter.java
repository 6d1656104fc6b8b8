package reaper.spi;

/**
 * Observability hook for exporting reaper counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Adds to the count of replicas claimed by the selector.
     *
     * @param count replicas in the claimed batch
     */
    void incrementReplicasClaimed(int count);

    /**
     * Increments the count of physical deletions that succeeded.
     */
    void incrementDeletionSuccess();

    /**
     * Increments the count of physical deletions that failed.
     */
    void incrementDeletionFailure();

    /**
     * Adds the size of a successfully deleted replica.
     *
     * @param bytes replica size in bytes
     */
    void addBytesReclaimed(long bytes);

    /**
     * Records a successful lease refresh. Not called when the store cannot report
     * how many rows were re-stamped.
     *
     * @param rows number of rows re-stamped
     */
    void incrementLeaseRefresh(int rows);

    /**
     * Increments the count of lease refreshes that failed.
     */
    void incrementLeaseRefreshFailure();

    /**
     * Adds to the count of rows removed from the catalog. Not called when the store
     * cannot report how many rows were removed.
     *
     * @param rows rows removed by one catalog delete
     */
    void incrementRowsCommitted(int rows);

    /**
     * Increments the count of catalog deletes that failed.
     */
    void incrementCommitFailure();

    /**
     * Records wall-clock time spent on one batch, from claim to final commit.
     *
     * @param durationMs duration in milliseconds (always non-negative)
     */
    default void recordBatchDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementReplicasClaimed(int count) {
        }

        @Override
        public void incrementDeletionSuccess() {
        }

        @Override
        public void incrementDeletionFailure() {
        }

        @Override
        public void addBytesReclaimed(long bytes) {
        }

        @Override
        public void incrementLeaseRefresh(int rows) {
        }

        @Override
        public void incrementLeaseRefreshFailure() {
        }

        @Override
        public void incrementRowsCommitted(int rows) {
        }

        @Override
        public void incrementCommitFailure() {
        }
    }
}
