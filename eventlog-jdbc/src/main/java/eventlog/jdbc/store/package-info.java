/**
 * JDBC event log stores for H2, MySQL and PostgreSQL, and their {@link java.util.ServiceLoader} registry.
 *
 * @see eventlog.jdbc.store.JdbcEventLogStores
 */
package eventlog.jdbc.store;
