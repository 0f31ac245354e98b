/**
 * JDBC implementations of the event log SPI.
 *
 * <p>{@link eventlog.jdbc.store.JdbcEventLogStores} picks the store for a database from
 * its JDBC URL. Table definitions for H2, MySQL and PostgreSQL ship as classpath resources
 * under {@code eventlog/schema/}.
 */
package eventlog.jdbc;
