package reaper.jdbc.store;

import reaper.jdbc.JdbcTemplate;
import reaper.jdbc.TableNames;
import reaper.model.Replica;
import reaper.model.ReplicaRef;
import reaper.model.ReplicaState;
import reaper.spi.ReplicaStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Base JDBC replica store with standard SQL implementations.
 *
 * <p>The default claim is portable: it reads candidate keys, then claims each one with a
 * conditional {@code UPDATE} that re-checks eligibility, and finally reads back the rows
 * tagged with the claim token. A row another worker won in between simply fails its
 * conditional update. Subclasses override {@link #claimBatch} to provide database-specific
 * claim strategies. Register custom implementations via
 * {@code META-INF/services/reaper.jdbc.store.AbstractJdbcReplicaStore}.
 *
 * @see JdbcReplicaStores
 */
public abstract class AbstractJdbcReplicaStore implements ReplicaStore {

  protected static final String STATE_AVAILABLE = "'" + ReplicaState.AVAILABLE.code() + "'";
  protected static final String STATE_BEING_DELETED = "'" + ReplicaState.BEING_DELETED.code() + "'";

  /** Eligibility predicate; the single parameter is the lease expiry. */
  protected static final String ELIGIBLE =
      "(state=" + STATE_AVAILABLE + " OR (state=" + STATE_BEING_DELETED + " AND updated_at < ?))";

  protected static final String REPLICA_COLUMNS = "scope, name, rse_id, state, updated_at, bytes, path";

  protected static final Comparator<Replica> BY_SCOPE_AND_NAME =
      Comparator.comparing(Replica::scope).thenComparing(Replica::name);

  protected static final JdbcTemplate.RowMapper<Replica> REPLICA_ROW_MAPPER = rs -> new Replica(
      new ReplicaRef(rs.getString("scope"), rs.getString("name"), rs.getString("rse_id")),
      ReplicaState.fromCode(rs.getString("state")),
      rs.getTimestamp("updated_at").toInstant(),
      rs.getLong("bytes"),
      rs.getString("path"));

  private static final JdbcTemplate.RowMapper<ReplicaRef> REF_ROW_MAPPER = rs -> new ReplicaRef(
      rs.getString("scope"), rs.getString("name"), rs.getString("rse_id"));

  private final String tableName;

  protected AbstractJdbcReplicaStore() {
    this(TableNames.DEFAULT_TABLE);
  }

  protected AbstractJdbcReplicaStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this replica store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this replica store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect operating on {@code tableName}.
   */
  public abstract AbstractJdbcReplicaStore withTableName(String tableName);

  public String tableName() {
    return tableName;
  }

  /**
   * Adds a catalog row. Not part of the reaper's own flow; the catalog is normally
   * populated by whatever system places replicas.
   */
  public void insert(Connection conn, Replica replica) {
    String sql = "INSERT INTO " + tableName() +
        " (scope, name, rse_id, state, updated_at, created_at, bytes, path, lease_owner)" +
        " VALUES (?,?,?,?,?,?,?,?,NULL)";
    Timestamp stamp = Timestamp.from(replica.updatedAt());
    JdbcTemplate.update(conn, sql,
        replica.scope(), replica.name(), replica.rseId(), replica.state().code(),
        stamp, stamp, replica.bytes(), replica.path());
  }

  @Override
  public List<Replica> claimBatch(Connection conn, String rseId, String claimToken,
      Instant now, Instant leaseExpiry, int limit) {
    String candidatesSql = "SELECT scope, name, rse_id FROM " + tableName() +
        " WHERE rse_id=? AND " + ELIGIBLE +
        " ORDER BY updated_at, scope, name LIMIT ?";
    List<ReplicaRef> candidates = JdbcTemplate.query(conn, candidatesSql, REF_ROW_MAPPER,
        rseId, Timestamp.from(leaseExpiry), limit);
    if (candidates.isEmpty()) return List.of();

    String claimSql = "UPDATE " + tableName() +
        " SET state=" + STATE_BEING_DELETED + ", updated_at=?, lease_owner=?" +
        " WHERE scope=? AND name=? AND rse_id=? AND " + ELIGIBLE;
    Timestamp stamp = Timestamp.from(now);
    Timestamp expiry = Timestamp.from(leaseExpiry);
    List<Object[]> rows = new ArrayList<>(candidates.size());
    for (ReplicaRef ref : candidates) {
      rows.add(new Object[]{stamp, claimToken, ref.scope(), ref.name(), ref.rseId(), expiry});
    }
    int updated = JdbcTemplate.updateBatch(conn, claimSql, rows);
    if (updated == 0) return List.of();
    return selectClaimed(conn, rseId, claimToken, now);
  }

  /**
   * Selects rows tagged with {@code claimToken} at lease stamp {@code stampedAt}.
   * Shared by subclasses that use a two-phase claim (UPDATE then SELECT).
   */
  protected List<Replica> selectClaimed(Connection conn, String rseId, String claimToken, Instant stampedAt) {
    String sql = "SELECT " + REPLICA_COLUMNS + " FROM " + tableName() +
        " WHERE rse_id=? AND lease_owner=? AND updated_at=? AND state=" + STATE_BEING_DELETED +
        " ORDER BY scope, name";
    return JdbcTemplate.query(conn, sql, REPLICA_ROW_MAPPER, rseId, claimToken, Timestamp.from(stampedAt));
  }

  @Override
  public int refreshLeases(Connection conn, String rseId, List<ReplicaRef> refs, Instant now) {
    if (refs.isEmpty()) return 0;
    String sql = "UPDATE " + tableName() + " SET updated_at=?" +
        " WHERE scope=? AND name=? AND rse_id=? AND state=" + STATE_BEING_DELETED;
    Timestamp stamp = Timestamp.from(now);
    List<Object[]> rows = new ArrayList<>(refs.size());
    for (ReplicaRef ref : refs) {
      rows.add(new Object[]{stamp, ref.scope(), ref.name(), rseId});
    }
    return JdbcTemplate.updateBatch(conn, sql, rows);
  }

  @Override
  public int deleteReplicas(Connection conn, List<ReplicaRef> refs) {
    if (refs.isEmpty()) return 0;
    String sql = "DELETE FROM " + tableName() + " WHERE scope=? AND name=? AND rse_id=?";
    List<Object[]> rows = new ArrayList<>(refs.size());
    for (ReplicaRef ref : refs) {
      rows.add(new Object[]{ref.scope(), ref.name(), ref.rseId()});
    }
    return JdbcTemplate.updateBatch(conn, sql, rows);
  }

  @Override
  public Optional<Replica> findReplica(Connection conn, ReplicaRef ref) {
    String sql = "SELECT " + REPLICA_COLUMNS + " FROM " + tableName() +
        " WHERE scope=? AND name=? AND rse_id=?";
    List<Replica> rows = JdbcTemplate.query(conn, sql, REPLICA_ROW_MAPPER,
        ref.scope(), ref.name(), ref.rseId());
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + tableName + "]";
  }
}
