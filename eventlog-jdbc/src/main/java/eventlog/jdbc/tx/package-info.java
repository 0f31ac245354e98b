/**
 * Manual JDBC transaction management.
 *
 * <p>{@link eventlog.jdbc.tx.JdbcTransactionManager} binds a connection to
 * {@link eventlog.jdbc.tx.ThreadLocalTxContext} so appends join the caller's transaction.
 */
package eventlog.jdbc.tx;
