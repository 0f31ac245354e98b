package eventlog.jdbc.store;

import eventlog.jdbc.JdbcTemplate;
import eventlog.util.JsonCodec;

import java.sql.Connection;
import java.sql.Timestamp;
import java.util.List;

/**
 * MySQL event log store. Also handles TiDB and MariaDB URLs.
 *
 * <p>Creates missing stream rows with a no-op {@code ON DUPLICATE KEY UPDATE}.
 */
public final class MySqlEventLogStore extends AbstractJdbcEventLogStore {

  public MySqlEventLogStore() {
    super();
  }

  public MySqlEventLogStore(String streamTable, String eventTable) {
    super(streamTable, eventTable);
  }

  public MySqlEventLogStore(String streamTable, String eventTable, JsonCodec jsonCodec) {
    super(streamTable, eventTable, jsonCodec);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:", "jdbc:mariadb:");
  }

  @Override
  public AbstractJdbcEventLogStore withTables(String streamTable, String eventTable) {
    return new MySqlEventLogStore(streamTable, eventTable, jsonCodec());
  }

  @Override
  public AbstractJdbcEventLogStore withJsonCodec(JsonCodec jsonCodec) {
    return new MySqlEventLogStore(streamTable(), eventTable(), jsonCodec);
  }

  @Override
  protected void insertStreamIfAbsent(Connection conn, String streamId, String aggregateType,
      String aggregateId, Timestamp now) {
    String sql = "INSERT INTO " + streamTable() +
        " (stream_id, aggregate_type, aggregate_id, version, created_at, updated_at)" +
        " VALUES (?,?,?,0,?,?) ON DUPLICATE KEY UPDATE stream_id=stream_id";
    JdbcTemplate.update(conn, sql, streamId, aggregateType, aggregateId, now, now);
  }
}
