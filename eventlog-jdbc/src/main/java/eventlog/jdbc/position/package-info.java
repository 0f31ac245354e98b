/**
 * JDBC persistence of projection positions.
 */
package eventlog.jdbc.position;
