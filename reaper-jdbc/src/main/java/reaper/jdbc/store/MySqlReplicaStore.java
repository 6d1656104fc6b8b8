package reaper.jdbc.store;

import reaper.jdbc.JdbcTemplate;
import reaper.model.Replica;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * MySQL replica store. Also compatible with TiDB.
 *
 * <p>Uses {@code UPDATE...ORDER BY...LIMIT} for the claim followed by a {@code SELECT}
 * of the rows tagged with the claim token. The {@code UPDATE} takes row locks on
 * every row it rewrites, so two concurrent claims never tag the same row; the token
 * keeps each read-back to the rows its own claim won.
 */
public final class MySqlReplicaStore extends AbstractJdbcReplicaStore {

  public MySqlReplicaStore() {
    super();
  }

  public MySqlReplicaStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcReplicaStore withTableName(String tableName) {
    return new MySqlReplicaStore(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public List<Replica> claimBatch(Connection conn, String rseId, String claimToken,
      Instant now, Instant leaseExpiry, int limit) {
    Objects.requireNonNull(claimToken, "claimToken");
    // MySQL supports UPDATE...ORDER BY...LIMIT (no subquery needed)
    String claimSql = "UPDATE " + tableName() +
        " SET state=" + STATE_BEING_DELETED + ", updated_at=?, lease_owner=?" +
        " WHERE rse_id=? AND " + ELIGIBLE +
        " ORDER BY updated_at, scope, name LIMIT ?";
    int updated = JdbcTemplate.update(conn, claimSql,
        Timestamp.from(now), claimToken, rseId, Timestamp.from(leaseExpiry), limit);
    if (updated == 0) return List.of();
    return selectClaimed(conn, rseId, claimToken, now);
  }
}
