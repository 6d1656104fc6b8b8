package reaper.jdbc.store;

import reaper.jdbc.TableNames;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC replica stores with auto-detection support.
 *
 * <p>Replica stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/reaper.jdbc.store.AbstractJdbcReplicaStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcReplicaStore store = JdbcReplicaStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL, custom table
 * AbstractJdbcReplicaStore store = JdbcReplicaStores.detect("jdbc:mysql://localhost/catalog", "cms_replicas");
 *
 * // Get by name
 * AbstractJdbcReplicaStore store = JdbcReplicaStores.get("postgresql");
 * }</pre>
 */
public final class JdbcReplicaStores {

  private static final List<AbstractJdbcReplicaStore> STORES;
  private static final Map<String, AbstractJdbcReplicaStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcReplicaStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcReplicaStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcReplicaStores() {
  }

  /**
   * Returns all registered replica stores.
   */
  public static List<AbstractJdbcReplicaStore> all() {
    return STORES;
  }

  /**
   * Gets a replica store by name.
   *
   * @param name replica store name (case-insensitive)
   * @return the replica store
   * @throws IllegalArgumentException if no replica store found
   */
  public static AbstractJdbcReplicaStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcReplicaStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown replica store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the replica store from a DataSource.
   *
   * @throws IllegalStateException if detection fails or no matching replica store
   */
  public static AbstractJdbcReplicaStore detect(DataSource dataSource) {
    return detect(dataSource, TableNames.DEFAULT_TABLE);
  }

  /**
   * Auto-detects the replica store from a DataSource, bound to {@code tableName}.
   *
   * @throws IllegalStateException if detection fails or no matching replica store
   */
  public static AbstractJdbcReplicaStore detect(DataSource dataSource, String tableName) {
    Objects.requireNonNull(dataSource, "dataSource");
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect replica store from DataSource", e);
    }
    try {
      return detect(url, tableName);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException(e.getMessage(), e);
    }
  }

  /**
   * Auto-detects the replica store from a JDBC URL.
   *
   * @throws IllegalArgumentException if no matching replica store found
   */
  public static AbstractJdbcReplicaStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    String lower = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcReplicaStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }

    throw new IllegalArgumentException("No replica store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  /**
   * Auto-detects the replica store from a JDBC URL, bound to {@code tableName}.
   *
   * @throws IllegalArgumentException if no matching replica store found or the table name is invalid
   */
  public static AbstractJdbcReplicaStore detect(String jdbcUrl, String tableName) {
    AbstractJdbcReplicaStore template = detect(jdbcUrl);
    if (template.tableName().equals(TableNames.validate(tableName))) {
      return template;
    }
    return template.withTableName(tableName);
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
