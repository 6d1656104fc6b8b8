package reaper.jdbc.store;

import java.util.List;

/**
 * H2 replica store. Primarily for testing.
 *
 * <p>Uses the default conditional two-phase claim from {@link AbstractJdbcReplicaStore}.
 */
public final class H2ReplicaStore extends AbstractJdbcReplicaStore {

  public H2ReplicaStore() {
    super();
  }

  public H2ReplicaStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcReplicaStore withTableName(String tableName) {
    return new H2ReplicaStore(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
