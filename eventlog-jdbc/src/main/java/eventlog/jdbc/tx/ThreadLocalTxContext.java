package eventlog.jdbc.tx;

import eventlog.spi.TxContext;

import java.sql.Connection;

/**
 * {@link TxContext} that keeps the transaction's connection in a {@link ThreadLocal}.
 *
 * <p>Bound and cleared by {@link JdbcTransactionManager}; an {@link eventlog.EventLog}
 * configured with this context appends on the bound connection.
 *
 * @see JdbcTransactionManager
 */
public final class ThreadLocalTxContext implements TxContext {
  private final ThreadLocal<Connection> connection = new ThreadLocal<>();

  @Override
  public boolean isTransactionActive() {
    return connection.get() != null;
  }

  @Override
  public Connection currentConnection() {
    Connection current = connection.get();
    if (current == null) {
      throw new IllegalStateException("No active transaction");
    }
    return current;
  }

  void bind(Connection conn) {
    if (connection.get() != null) {
      throw new IllegalStateException("Transaction already active");
    }
    connection.set(conn);
  }

  void clear() {
    connection.remove();
  }
}
