/**
 * JDBC-based {@link reaper.spi.ReplicaStore} implementations.
 *
 * <p>{@link reaper.jdbc.store.AbstractJdbcReplicaStore} provides shared SQL and row mapping;
 * subclasses supply database-specific claim strategies: H2 (conditional per-row update),
 * MySQL ({@code UPDATE...ORDER BY...LIMIT}), and PostgreSQL
 * ({@code FOR UPDATE SKIP LOCKED}).
 *
 * @see reaper.jdbc.store.AbstractJdbcReplicaStore
 * @see reaper.jdbc.store.H2ReplicaStore
 * @see reaper.jdbc.store.MySqlReplicaStore
 * @see reaper.jdbc.store.PostgresReplicaStore
 * @see reaper.jdbc.store.JdbcReplicaStores
 */
package reaper.jdbc.store;
