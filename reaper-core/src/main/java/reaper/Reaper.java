package reaper;

import reaper.cleanup.CatalogCleaner;
import reaper.cleanup.CatalogCommitException;
import reaper.model.BatchReport;
import reaper.model.Replica;
import reaper.model.ReplicaBatch;
import reaper.refresh.LeaseRefresher;
import reaper.select.ReplicaSelector;
import reaper.spi.ConnectionProvider;
import reaper.spi.MetricsExporter;
import reaper.spi.PhysicalDeleter;
import reaper.spi.ReplicaStore;
import reaper.util.DaemonThreadFactory;
import reaper.worker.DeletionWorker;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Outer reaper loop: claims a batch per storage location, deletes it, and makes sure
 * every success ends up removed from the catalog.
 *
 * <p>In deferred cleanup mode the worker hands all successes back and this loop deletes
 * them in slices of {@code db_batch_size}. In immediate mode the worker commits as it
 * goes. When a catalog delete fails the loop retries the uncommitted rows once; if that
 * fails too they are left leased, a later claim deletes them again, and {@link #reap}
 * throws a {@link CatalogCommitException} with the committed and uncommitted counts.
 *
 * <p>Many reaper processes may run against the same store. They coordinate only through
 * row leases; a crashed process simply lets its leases expire.
 *
 * <p>Create instances via {@link #builder()}. The {@link #start()} and {@link #close()}
 * methods are synchronized to prevent concurrent lifecycle transitions.
 *
 * @see Reaper.Builder
 */
public final class Reaper implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(Reaper.class.getName());

    private final ReaperConfig config;
    private final List<String> rseIds;
    private final long intervalMs;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final ReplicaSelector selector;
    private final DeletionWorker worker;
    private final CatalogCleaner catalogCleaner;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> reapTask;
    private volatile boolean closed;

    private Reaper(Builder builder) {
        ConnectionProvider connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        ReplicaStore replicaStore = Objects.requireNonNull(builder.replicaStore, "replicaStore");
        PhysicalDeleter deleter = Objects.requireNonNull(builder.deleter, "deleter");
        this.rseIds = List.copyOf(Objects.requireNonNull(builder.rseIds, "rseIds"));

        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }

        this.config = builder.config != null ? builder.config : ReaperConfig.defaults();
        this.intervalMs = builder.intervalMs;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        String workerId = builder.workerId != null
                ? builder.workerId
                : "reaper-" + UUID.randomUUID().toString().substring(0, 8);

        this.selector = new ReplicaSelector(connectionProvider, replicaStore, workerId, clock, metrics);
        this.catalogCleaner = new CatalogCleaner(connectionProvider, replicaStore, metrics);
        LeaseRefresher refresher = new LeaseRefresher(connectionProvider, replicaStore, clock, metrics);
        this.worker = new DeletionWorker(deleter, refresher, catalogCleaner, clock, metrics);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the scheduled reaping loop. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("Reaper has been closed");
        }
        if (reapTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("reaper-"));
        reapTask = scheduler.scheduleWithFixedDelay(this::runOnce, 0L, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Reaps one batch at every configured storage location. A failure at one location is
     * logged and does not prevent the others from being reaped.
     *
     * <p>Called automatically by the scheduler, but may also be invoked directly.
     *
     * @return the reports of the batches processed in this cycle
     */
    public List<BatchReport> runOnce() {
        List<BatchReport> reports = new ArrayList<>(rseIds.size());
        if (closed) {
            return reports;
        }
        for (String rseId : rseIds) {
            try {
                reports.add(reap(rseId));
            } catch (Throwable t) {
                logger.log(Level.SEVERE, "Reaper cycle failed at rse=" + rseId, t);
            }
        }
        return reports;
    }

    /**
     * Claims, deletes and commits one batch at {@code rseId}.
     *
     * @return the batch report, or an empty report if nothing was eligible
     * @throws ReaperException         if the claim could not be made
     * @throws CatalogCommitException if deleted replicas are still in the catalog after the
     *                                retry; carries the committed count, the uncommitted
     *                                replicas and the batch report
     */
    public BatchReport reap(String rseId) {
        long startedAt = clock.millis();
        ReplicaBatch batch = selector.select(rseId, config);
        if (batch.isEmpty()) {
            logger.log(Level.FINE, "No eligible replicas at rse={0}", rseId);
            return BatchReport.empty(rseId);
        }

        try {
            BatchReport report;
            try {
                report = worker.process(batch, config);
            } catch (CatalogCommitException e) {
                BatchReport partial = e.report() != null ? e.report() : BatchReport.empty(rseId);
                commitWithRetry(rseId, e.uncommitted(), e.committedCount(), partial);
                logger.log(Level.WARNING, "Recovered {0} uncommitted replicas at rse={1}",
                        new Object[]{e.uncommitted().size(), rseId});
                return partial;
            }

            if (!report.remainder().isEmpty()) {
                commitWithRetry(rseId, report.remainder(), report.committedByWorker(), report);
                logger.log(Level.INFO, "Removed {0} deleted replicas from the catalog at rse={1}",
                        new Object[]{report.remainder().size(), rseId});
            }
            return report;
        } finally {
            metrics.recordBatchDurationMs(Math.max(0L, clock.millis() - startedAt));
        }
    }

    /**
     * Removes {@code replicas} from the catalog in {@code db_batch_size} slices, retrying a
     * failed slice once. A slice that fails twice ends the cleanup.
     *
     * @param alreadyCommitted successes of the batch removed from the catalog before this call
     * @throws CatalogCommitException listing the slice that failed and every slice after it
     */
    private void commitWithRetry(String rseId, List<Replica> replicas, int alreadyCommitted, BatchReport report) {
        int committed = alreadyCommitted;
        int sliceSize = config.dbBatchSize();
        for (int from = 0; from < replicas.size(); from += sliceSize) {
            List<Replica> slice = replicas.subList(from, Math.min(from + sliceSize, replicas.size()));
            try {
                deleteWithRetry(slice);
            } catch (RuntimeException e) {
                List<Replica> uncommitted = replicas.subList(from, replicas.size());
                logger.log(Level.SEVERE, "Giving up on catalog cleanup at rse=" + rseId + ": " +
                        uncommitted.size() + " deleted replicas stay leased until their lease expires", e);
                throw new CatalogCommitException("Catalog cleanup failed at rse=" + rseId + " with " +
                        committed + " replicas committed and " + uncommitted.size() + " uncommitted",
                        e, committed, uncommitted, report);
            }
            committed += slice.size();
        }
    }

    private void deleteWithRetry(List<Replica> slice) {
        try {
            catalogCleaner.deleteRows(slice);
        } catch (RuntimeException first) {
            logger.log(Level.WARNING, "Catalog delete of " + slice.size() + " replicas failed, retrying once", first);
            catalogCleaner.deleteRows(slice);
        }
    }

    public ReaperConfig config() {
        return config;
    }

    public String workerId() {
        return selector.workerId();
    }

    /**
     * Cancels the reaping schedule and shuts down the scheduler thread.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (reapTask != null) {
            reapTask.cancel(false);
            reapTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Builder for {@link Reaper}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private ReplicaStore replicaStore;
        private PhysicalDeleter deleter;
        private ReaperConfig config;
        private List<String> rseIds = List.of();
        private String workerId;
        private long intervalMs = 60_000L;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * Sets the connection provider used for claims, refreshes and catalog deletes.
         *
         * <p><b>Required.</b>
         *
         * @param connectionProvider the connection provider
         * @return this builder
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * Sets the lease store and catalog.
         *
         * <p><b>Required.</b>
         *
         * @param replicaStore the persistence backend
         * @return this builder
         */
        public Builder replicaStore(ReplicaStore replicaStore) {
            this.replicaStore = replicaStore;
            return this;
        }

        /**
         * Sets the collaborator that removes physical copies from storage endpoints.
         *
         * <p><b>Required.</b>
         *
         * @param deleter the physical deleter
         * @return this builder
         */
        public Builder deleter(PhysicalDeleter deleter) {
            this.deleter = deleter;
            return this;
        }

        /**
         * Sets the batching, lease and cleanup configuration.
         *
         * <p>Optional. Defaults to {@link ReaperConfig#defaults()}.
         *
         * @param config the reaper configuration
         * @return this builder
         */
        public Builder config(ReaperConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Sets the storage locations reaped on every cycle, in order.
         *
         * <p>Optional. Defaults to none, in which case only {@link Reaper#reap} does work.
         *
         * @param rseIds storage location identifiers
         * @return this builder
         */
        public Builder rseIds(List<String> rseIds) {
            this.rseIds = rseIds;
            return this;
        }

        /**
         * Sets the identifier recorded as lease owner on claimed rows.
         *
         * <p>Optional. Defaults to {@code reaper-<random>}.
         *
         * @param workerId unique identifier for this process (e.g. hostname or pod name)
         * @return this builder
         */
        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        /**
         * Sets the delay between two reaping cycles in milliseconds.
         *
         * <p>Optional. Defaults to {@code 60000} ms. Must be &gt; 0.
         *
         * @param intervalMs cycle delay in milliseconds
         * @return this builder
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the clock used for lease stamps and elapsed-time checks.
         *
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Builds the reaper. Call {@link Reaper#start()} to begin the reaping schedule.
         *
         * @return a new {@link Reaper} instance
         * @throws NullPointerException     if {@code connectionProvider}, {@code replicaStore},
         *                                  {@code deleter} or {@code rseIds} is null
         * @throws IllegalArgumentException if {@code intervalMs <= 0}
         */
        public Reaper build() {
            return new Reaper(this);
        }
    }
}
