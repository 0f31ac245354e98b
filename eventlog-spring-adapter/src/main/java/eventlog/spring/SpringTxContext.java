package eventlog.spring;

import eventlog.spi.TxContext;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Objects;

/**
 * {@link TxContext} that joins Spring-managed transactions.
 *
 * <p>Inside a transaction started by a Spring {@code PlatformTransactionManager} for the
 * same {@link DataSource}, appends run on the transaction's connection obtained through
 * {@link DataSourceUtils}, so events commit or roll back with the caller's writes.
 * Outside a transaction, {@link eventlog.EventLog} falls back to its own connection.
 *
 * @see TxContext
 */
public final class SpringTxContext implements TxContext {
  private final DataSource dataSource;

  public SpringTxContext(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public boolean isTransactionActive() {
    return TransactionSynchronizationManager.isActualTransactionActive()
        && !TransactionSynchronizationManager.isCurrentTransactionReadOnly();
  }

  @Override
  public Connection currentConnection() {
    if (!isTransactionActive()) {
      throw new IllegalStateException("No active transaction");
    }
    return DataSourceUtils.getConnection(dataSource);
  }
}
