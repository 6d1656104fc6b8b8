package reaper.refresh;

import reaper.ReaperConfig;
import reaper.model.ReplicaRef;
import reaper.spi.ConnectionProvider;
import reaper.spi.MetricsExporter;
import reaper.spi.ReplicaStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Extends the leases of replicas a worker still has to process, so that no other
 * worker re-claims them mid-batch.
 *
 * <p>A refresh fires once the lease age exceeds
 * {@code refresh_trigger_ratio / 100 * delay_seconds}. It re-stamps only rows still in
 * {@code BEING_DELETED}; rows that were removed or reassigned in the meantime are left
 * alone. Failures are absorbed: they are logged and reported as {@code false}, and the
 * worker keeps going with a higher risk of its leases being taken over.
 *
 * <p>Refreshing the same set twice is harmless; it only moves {@code updated_at} forward.
 */
public final class LeaseRefresher {
    private static final Logger logger = Logger.getLogger(LeaseRefresher.class.getName());

    private final ConnectionProvider connectionProvider;
    private final ReplicaStore replicaStore;
    private final Clock clock;
    private final MetricsExporter metrics;

    public LeaseRefresher(ConnectionProvider connectionProvider, ReplicaStore replicaStore,
                          Clock clock, MetricsExporter metrics) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.replicaStore = Objects.requireNonNull(replicaStore, "replicaStore");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    }

    /**
     * Returns whether a lease of age {@code elapsed} over {@code outstandingCount} rows is
     * due for a refresh.
     */
    public static boolean isDue(Duration elapsed, int outstandingCount, ReaperConfig config) {
        return outstandingCount > 0 && elapsed.compareTo(config.refreshTriggerTime()) > 0;
    }

    /**
     * Refreshes {@code outstanding} if the lease age has passed the trigger time.
     *
     * @param rseId       storage location of the batch
     * @param elapsed     time since the leases were last stamped
     * @param outstanding replicas not yet processed
     * @param config      supplies {@code refresh_trigger_ratio} and {@code delay_seconds}
     * @return {@code true} if a refresh was issued and succeeded
     */
    public boolean maybeRefresh(String rseId, Duration elapsed, List<ReplicaRef> outstanding,
                                ReaperConfig config) {
        return refreshIfDue(rseId, elapsed, outstanding, config).isPresent();
    }

    /**
     * Same as {@link #maybeRefresh} but returns the stamp written to the store, which is
     * where the new lease age is measured from.
     *
     * @return the new lease stamp, or empty if no refresh was due or it failed
     */
    public Optional<Instant> refreshIfDue(String rseId, Duration elapsed, List<ReplicaRef> outstanding,
                                          ReaperConfig config) {
        Objects.requireNonNull(elapsed, "elapsed");
        Objects.requireNonNull(outstanding, "outstanding");
        Objects.requireNonNull(config, "config");
        if (!isDue(elapsed, outstanding.size(), config)) {
            return Optional.empty();
        }
        logger.log(Level.INFO, "Lease refresh triggered rse={0} elapsedMs={1} outstanding={2}",
                new Object[]{rseId, elapsed.toMillis(), outstanding.size()});
        return stamp(rseId, outstanding);
    }

    /**
     * Re-stamps the given replicas unconditionally.
     *
     * @return {@code false} if the store could not be updated
     */
    public boolean refresh(String rseId, List<ReplicaRef> refs) {
        return stamp(rseId, refs).isPresent();
    }

    private Optional<Instant> stamp(String rseId, List<ReplicaRef> refs) {
        Objects.requireNonNull(rseId, "rseId");
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        if (refs.isEmpty()) {
            return Optional.of(now);
        }
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(false);
            int touched;
            try {
                touched = replicaStore.refreshLeases(conn, rseId, refs, now);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
            if (touched == ReplicaStore.UNKNOWN_ROW_COUNT) {
                logger.log(Level.FINE, "Lease refresh at rse={0} committed without a row count", rseId);
            } else {
                metrics.incrementLeaseRefresh(touched);
                if (touched < refs.size()) {
                    logger.log(Level.FINE, "Lease refresh at rse={0} skipped {1} of {2} rows no longer being deleted",
                            new Object[]{rseId, refs.size() - touched, refs.size()});
                }
            }
            return Optional.of(now);
        } catch (SQLException | RuntimeException e) {
            metrics.incrementLeaseRefreshFailure();
            logger.log(Level.WARNING, "Lease refresh failed at rse=" + rseId +
                    " for " + refs.size() + " replicas; continuing without extended leases", e);
            return Optional.empty();
        }
    }
}
