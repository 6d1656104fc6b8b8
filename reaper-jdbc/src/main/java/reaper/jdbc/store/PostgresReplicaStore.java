package reaper.jdbc.store;

import reaper.jdbc.JdbcTemplate;
import reaper.model.Replica;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL replica store.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for a
 * single-round-trip claim. Concurrent workers skip each other's candidate rows
 * instead of waiting on them.
 */
public final class PostgresReplicaStore extends AbstractJdbcReplicaStore {

  public PostgresReplicaStore() {
    super();
  }

  public PostgresReplicaStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcReplicaStore withTableName(String tableName) {
    return new PostgresReplicaStore(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public List<Replica> claimBatch(Connection conn, String rseId, String claimToken,
      Instant now, Instant leaseExpiry, int limit) {
    String sql = "UPDATE " + tableName() +
        " SET state=" + STATE_BEING_DELETED + ", updated_at=?, lease_owner=?" +
        " WHERE (scope, name, rse_id) IN (" +
        "SELECT scope, name, rse_id FROM " + tableName() +
        " WHERE rse_id=? AND " + ELIGIBLE +
        " ORDER BY updated_at, scope, name LIMIT ?" +
        " FOR UPDATE SKIP LOCKED" +
        ") RETURNING " + REPLICA_COLUMNS;
    List<Replica> claimed = new ArrayList<>(JdbcTemplate.updateReturning(conn, sql, REPLICA_ROW_MAPPER,
        Timestamp.from(now), claimToken, rseId, Timestamp.from(leaseExpiry), limit));
    // RETURNING has no defined order
    claimed.sort(BY_SCOPE_AND_NAME);
    return claimed;
  }
}
