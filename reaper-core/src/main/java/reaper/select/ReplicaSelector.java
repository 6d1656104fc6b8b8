package reaper.select;

import reaper.ReaperConfig;
import reaper.ReaperException;
import reaper.model.Replica;
import reaper.model.ReplicaBatch;
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
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Claims bounded batches of eligible replicas for one worker.
 *
 * <p>A replica is eligible when it is {@code AVAILABLE}, or {@code BEING_DELETED} with a
 * lease stamp older than the lease duration, regardless of which worker stamped it.
 * Each claim runs in its own transaction and tags the rows with a token unique to the
 * call, so the rows read back are exactly the rows this call won.
 */
public final class ReplicaSelector {
    private static final Logger logger = Logger.getLogger(ReplicaSelector.class.getName());

    private final ConnectionProvider connectionProvider;
    private final ReplicaStore replicaStore;
    private final String workerId;
    private final Clock clock;
    private final MetricsExporter metrics;
    private final AtomicLong claimSequence = new AtomicLong();

    public ReplicaSelector(ConnectionProvider connectionProvider, ReplicaStore replicaStore,
                           String workerId, Clock clock, MetricsExporter metrics) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.replicaStore = Objects.requireNonNull(replicaStore, "replicaStore");
        this.workerId = Objects.requireNonNull(workerId, "workerId");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    }

    /**
     * Claims up to {@link ReaperConfig#chunkSize()} replicas with the configured lease duration.
     */
    public ReplicaBatch select(String rseId, ReaperConfig config) {
        Objects.requireNonNull(config, "config");
        return select(rseId, config.chunkSize(), config.leaseDuration());
    }

    /**
     * Claims up to {@code chunkSize} eligible replicas at {@code rseId}.
     *
     * @param rseId         storage location to claim at
     * @param chunkSize     maximum batch size, must be &gt; 0
     * @param leaseDuration age after which a {@code BEING_DELETED} row is claimable again
     * @return the claimed batch; empty if nothing is eligible
     * @throws IllegalArgumentException if {@code chunkSize <= 0}
     * @throws ReaperException          if the claim transaction fails
     */
    public ReplicaBatch select(String rseId, int chunkSize, Duration leaseDuration) {
        Objects.requireNonNull(rseId, "rseId");
        Objects.requireNonNull(leaseDuration, "leaseDuration");
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        // Truncate to millis so the stamp survives a database round trip unchanged
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Instant leaseExpiry = now.minus(leaseDuration);
        String claimToken = workerId + ":" + claimSequence.incrementAndGet();

        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(false);
            try {
                List<Replica> claimed = replicaStore.claimBatch(conn, rseId, claimToken, now, leaseExpiry, chunkSize);
                conn.commit();
                if (!claimed.isEmpty()) {
                    metrics.incrementReplicasClaimed(claimed.size());
                    logger.log(Level.FINE, "Claimed {0} replicas at rse={1} token={2}",
                            new Object[]{claimed.size(), rseId, claimToken});
                }
                return new ReplicaBatch(rseId, claimed, now);
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new ReaperException("Failed to claim replicas at rse=" + rseId, e);
        }
    }

    public String workerId() {
        return workerId;
    }
}
