package eventlog.jdbc.store;

import eventlog.EventStoreException;
import eventlog.jdbc.JdbcTemplate;
import eventlog.util.JsonCodec;

import java.sql.Connection;
import java.sql.Timestamp;
import java.util.List;

/**
 * H2 event log store. Primarily for testing.
 *
 * <p>Creates missing stream rows with {@code INSERT ... WHERE NOT EXISTS}. A duplicate key
 * raised by a concurrent creator is ignored; H2 only rolls back the failed statement.
 */
public final class H2EventLogStore extends AbstractJdbcEventLogStore {

  public H2EventLogStore() {
    super();
  }

  public H2EventLogStore(String streamTable, String eventTable) {
    super(streamTable, eventTable);
  }

  public H2EventLogStore(String streamTable, String eventTable, JsonCodec jsonCodec) {
    super(streamTable, eventTable, jsonCodec);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public AbstractJdbcEventLogStore withTables(String streamTable, String eventTable) {
    return new H2EventLogStore(streamTable, eventTable, jsonCodec());
  }

  @Override
  public AbstractJdbcEventLogStore withJsonCodec(JsonCodec jsonCodec) {
    return new H2EventLogStore(streamTable(), eventTable(), jsonCodec);
  }

  @Override
  protected void insertStreamIfAbsent(Connection conn, String streamId, String aggregateType,
      String aggregateId, Timestamp now) {
    String sql = "INSERT INTO " + streamTable() +
        " (stream_id, aggregate_type, aggregate_id, version, created_at, updated_at)" +
        " SELECT ?, ?, ?, 0, ?, ? FROM DUAL WHERE NOT EXISTS (" +
        "SELECT 1 FROM " + streamTable() + " WHERE aggregate_type=? AND aggregate_id=?)";
    try {
      JdbcTemplate.update(conn, sql, streamId, aggregateType, aggregateId, now, now,
          aggregateType, aggregateId);
    } catch (EventStoreException e) {
      if (!JdbcTemplate.isConflict(e)) {
        throw e;
      }
      // another transaction created the stream first; the row lock that follows waits for it
    }
  }
}
