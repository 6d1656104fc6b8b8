package reaper.spi;

import reaper.model.Replica;
import reaper.model.ReplicaRef;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Shared lease table and catalog for replicas.
 *
 * <p>Leases are represented by row state and timestamp only: claiming sets
 * {@code state = BEING_DELETED, updated_at = now}, and a row whose
 * {@code updated_at} is older than the lease duration may be claimed again by anyone.
 * There is no other lock.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Implementations live in the {@code reaper-jdbc} module.
 *
 * @see reaper.jdbc.store.AbstractJdbcReplicaStore
 */
public interface ReplicaStore {

    /**
     * Returned by {@link #refreshLeases} and {@link #deleteReplicas} when the database
     * confirmed the statements but not how many rows they touched.
     */
    int UNKNOWN_ROW_COUNT = -1;


    /**
     * Claims up to {@code limit} replicas at {@code rseId} that are either
     * {@code AVAILABLE} or {@code BEING_DELETED} with {@code updated_at < leaseExpiry}.
     *
     * <p>Each claimed row is set to {@code BEING_DELETED}, stamped with {@code now} and
     * tagged with {@code claimToken}. Implementations must guarantee that two concurrent
     * calls never return the same row.
     *
     * @param conn        the JDBC connection (within a transaction)
     * @param rseId       storage location to claim at
     * @param claimToken  unique token for this claim, stored as the lease owner
     * @param now         lease stamp, already truncated to milliseconds
     * @param leaseExpiry rows stamped before this instant are claimable again
     * @param limit       maximum number of rows to claim
     * @return the claimed replicas, ordered by scope then name
     */
    List<Replica> claimBatch(Connection conn, String rseId, String claimToken,
                             Instant now, Instant leaseExpiry, int limit);

    /**
     * Re-stamps {@code updated_at = now} on the given replicas, touching only rows still
     * in {@code BEING_DELETED}. Rows that were removed or reassigned are skipped.
     *
     * @param conn  the JDBC connection
     * @param rseId storage location of the replicas
     * @param refs  replicas whose lease should be extended
     * @param now   new lease stamp
     * @return the number of rows re-stamped, or {@link #UNKNOWN_ROW_COUNT}
     */
    int refreshLeases(Connection conn, String rseId, List<ReplicaRef> refs, Instant now);

    /**
     * Removes the given replicas from the catalog.
     *
     * @param conn the JDBC connection (typically within a transaction)
     * @param refs replicas whose physical copy has been deleted
     * @return the number of rows removed; lower than {@code refs.size()} when some rows
     *         were already gone, or {@link #UNKNOWN_ROW_COUNT}
     */
    int deleteReplicas(Connection conn, List<ReplicaRef> refs);

    /**
     * Looks up a single replica row.
     *
     * @param conn the JDBC connection
     * @param ref  replica identity
     * @return the row, or empty if it does not exist
     */
    Optional<Replica> findReplica(Connection conn, ReplicaRef ref);

    /**
     * Returns the current lease stamp of a replica. Intended for diagnostics and tests.
     *
     * @param conn the JDBC connection
     * @param ref  replica identity
     * @return the {@code updated_at} value, or empty if the row does not exist
     */
    default Optional<Instant> findUpdatedAt(Connection conn, ReplicaRef ref) {
        return findReplica(conn, ref).map(Replica::updatedAt);
    }
}
