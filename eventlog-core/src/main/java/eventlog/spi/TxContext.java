package eventlog.spi;

import java.sql.Connection;

/**
 * Exposes the caller's active transaction so appends can join it.
 *
 * <p>When a transaction is active, {@link eventlog.EventLog} writes events on
 * {@link #currentConnection()} and leaves commit and rollback to the caller.
 *
 * @see eventlog.jdbc.tx.ThreadLocalTxContext
 * @see eventlog.spring.SpringTxContext
 */
public interface TxContext {

    /**
     * Transaction context that never reports an active transaction.
     */
    TxContext NONE = new TxContext() {
        @Override
        public boolean isTransactionActive() {
            return false;
        }

        @Override
        public Connection currentConnection() {
            throw new IllegalStateException("No active transaction");
        }
    };

    /**
     * Returns {@code true} if a transaction is bound to the current thread.
     */
    boolean isTransactionActive();

    /**
     * Returns the connection of the active transaction.
     *
     * @throws IllegalStateException if no transaction is active
     */
    Connection currentConnection();
}
