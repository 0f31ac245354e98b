package eventlog.jdbc.store;

import eventlog.jdbc.JdbcTemplate;
import eventlog.util.JsonCodec;

import java.sql.Connection;
import java.sql.Timestamp;
import java.util.List;

/**
 * PostgreSQL event log store.
 *
 * <p>Creates missing stream rows with {@code ON CONFLICT DO NOTHING}, which never aborts
 * the surrounding transaction.
 */
public final class PostgresEventLogStore extends AbstractJdbcEventLogStore {

  public PostgresEventLogStore() {
    super();
  }

  public PostgresEventLogStore(String streamTable, String eventTable) {
    super(streamTable, eventTable);
  }

  public PostgresEventLogStore(String streamTable, String eventTable, JsonCodec jsonCodec) {
    super(streamTable, eventTable, jsonCodec);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public AbstractJdbcEventLogStore withTables(String streamTable, String eventTable) {
    return new PostgresEventLogStore(streamTable, eventTable, jsonCodec());
  }

  @Override
  public AbstractJdbcEventLogStore withJsonCodec(JsonCodec jsonCodec) {
    return new PostgresEventLogStore(streamTable(), eventTable(), jsonCodec);
  }

  @Override
  protected void insertStreamIfAbsent(Connection conn, String streamId, String aggregateType,
      String aggregateId, Timestamp now) {
    String sql = "INSERT INTO " + streamTable() +
        " (stream_id, aggregate_type, aggregate_id, version, created_at, updated_at)" +
        " VALUES (?,?,?,0,?,?) ON CONFLICT (aggregate_type, aggregate_id) DO NOTHING";
    JdbcTemplate.update(conn, sql, streamId, aggregateType, aggregateId, now, now);
  }
}
