package eventlog.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for work that runs outside a caller's transaction
 * (event queries, projection position updates, standalone appends).
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see eventlog.jdbc.DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
