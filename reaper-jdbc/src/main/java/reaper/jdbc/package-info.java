/**
 * JDBC plumbing shared by the replica stores: a {@link javax.sql.DataSource}-backed
 * {@link reaper.spi.ConnectionProvider}, the {@link reaper.jdbc.JdbcTemplate} helper and
 * table name validation.
 *
 * @see reaper.jdbc.store
 */
package reaper.jdbc;
