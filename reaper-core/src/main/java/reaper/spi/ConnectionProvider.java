package reaper.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to the selector, refresher and committers. Every
 * store call is made on a connection obtained here.
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see reaper.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
