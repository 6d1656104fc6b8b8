package reaper.cleanup;

import reaper.ReaperException;
import reaper.model.Replica;
import reaper.model.ReplicaRef;
import reaper.spi.ConnectionProvider;
import reaper.spi.MetricsExporter;
import reaper.spi.ReplicaStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Removes replicas from the catalog, one transaction per call.
 *
 * <p>A delete that matches fewer rows than requested is not an error: the missing rows
 * were already removed, and a removed row stays removed.
 */
public final class CatalogCleaner {
    private static final Logger logger = Logger.getLogger(CatalogCleaner.class.getName());

    private final ConnectionProvider connectionProvider;
    private final ReplicaStore replicaStore;
    private final MetricsExporter metrics;

    public CatalogCleaner(ConnectionProvider connectionProvider, ReplicaStore replicaStore,
                          MetricsExporter metrics) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.replicaStore = Objects.requireNonNull(replicaStore, "replicaStore");
        this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    }

    /**
     * Deletes the catalog rows of {@code replicas}.
     *
     * @return the number of rows removed, or {@link ReplicaStore#UNKNOWN_ROW_COUNT} if the
     *         store could not tell; in that case no row count is reported to the metrics
     * @throws ReaperException if the delete could not be committed
     */
    public int deleteRows(List<Replica> replicas) {
        if (replicas.isEmpty()) {
            return 0;
        }
        List<ReplicaRef> refs = replicas.stream().map(Replica::ref).toList();
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(false);
            int deleted;
            try {
                deleted = replicaStore.deleteReplicas(conn, refs);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
            if (deleted == ReplicaStore.UNKNOWN_ROW_COUNT) {
                logger.log(Level.FINE, "Catalog delete of {0} rows committed without a row count",
                        refs.size());
                return deleted;
            }
            metrics.incrementRowsCommitted(deleted);
            if (deleted < refs.size()) {
                logger.log(Level.INFO, "Catalog delete removed {0} of {1} rows; the rest were already gone",
                        new Object[]{deleted, refs.size()});
            }
            return deleted;
        } catch (SQLException e) {
            metrics.incrementCommitFailure();
            throw new ReaperException("Failed to delete " + refs.size() + " catalog rows", e);
        } catch (RuntimeException e) {
            metrics.incrementCommitFailure();
            throw e;
        }
    }
}
