package eventlog.jdbc.position;

import eventlog.EventStoreException;
import eventlog.jdbc.JdbcTemplate;
import eventlog.jdbc.TableNames;
import eventlog.model.ProjectionPosition;
import eventlog.spi.ProjectionPositionStore;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores projection positions in a single table keyed by projection name.
 *
 * <p>{@link #save} is a portable upsert: update first, insert when no row exists, and
 * update again if a concurrent insert won the race. Works unchanged on H2, MySQL and PostgreSQL.
 */
public final class JdbcProjectionPositionStore implements ProjectionPositionStore {
  private final String tableName;

  public JdbcProjectionPositionStore() {
    this(TableNames.POSITION_TABLE);
  }

  public JdbcProjectionPositionStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  public String tableName() {
    return tableName;
  }

  @Override
  public Optional<ProjectionPosition> find(Connection conn, String projectionName) {
    Objects.requireNonNull(projectionName, "projectionName");
    String sql = "SELECT projection_name, last_event_id, last_global_sequence, events_processed, " +
        "last_processed_at FROM " + tableName + " WHERE projection_name=?";
    return JdbcTemplate.query(conn, sql, JdbcProjectionPositionStore::mapPosition, projectionName)
        .stream().findFirst();
  }

  @Override
  public void save(Connection conn, ProjectionPosition position) {
    Objects.requireNonNull(position, "position");
    if (update(conn, position) == 1) {
      return;
    }
    try {
      JdbcTemplate.update(conn, "INSERT INTO " + tableName +
              " (projection_name, last_event_id, last_global_sequence, events_processed, last_processed_at)" +
              " VALUES (?,?,?,?,?)",
          position.projectionName(), position.lastEventId(), position.lastGlobalSequence(),
          position.eventsProcessed(), timestamp(position));
    } catch (EventStoreException e) {
      if (!JdbcTemplate.isConflict(e) || update(conn, position) != 1) {
        throw e;
      }
    }
  }

  @Override
  public boolean delete(Connection conn, String projectionName) {
    Objects.requireNonNull(projectionName, "projectionName");
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName + " WHERE projection_name=?", projectionName) > 0;
  }

  private int update(Connection conn, ProjectionPosition position) {
    return JdbcTemplate.update(conn, "UPDATE " + tableName +
            " SET last_event_id=?, last_global_sequence=?, events_processed=?, last_processed_at=?" +
            " WHERE projection_name=?",
        position.lastEventId(), position.lastGlobalSequence(), position.eventsProcessed(),
        timestamp(position), position.projectionName());
  }

  private static Timestamp timestamp(ProjectionPosition position) {
    return position.lastProcessedAt() == null ? null : Timestamp.from(position.lastProcessedAt());
  }

  private static ProjectionPosition mapPosition(ResultSet rs) throws SQLException {
    long sequence = rs.getLong("last_global_sequence");
    Long lastGlobalSequence = rs.wasNull() ? null : sequence;
    Timestamp processedAt = rs.getTimestamp("last_processed_at");
    return new ProjectionPosition(
        rs.getString("projection_name"),
        rs.getString("last_event_id"),
        lastGlobalSequence,
        rs.getLong("events_processed"),
        processedAt == null ? null : processedAt.toInstant());
  }
}
