package eventlog.jdbc.store;

import com.github.f4b6a3.ulid.UlidCreator;
import eventlog.ConcurrencyConflictException;
import eventlog.EventStoreException;
import eventlog.NewEvent;
import eventlog.jdbc.JdbcTemplate;
import eventlog.jdbc.TableNames;
import eventlog.model.DomainEvent;
import eventlog.model.EventStream;
import eventlog.spi.EventLogStore;
import eventlog.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.StringJoiner;

/**
 * Base JDBC event log store with standard SQL implementations.
 *
 * <p>An append creates the stream row if needed, locks it with {@code SELECT ... FOR UPDATE},
 * checks the expected version, rejects event ids that are already stored, advances the
 * version with a conditional update and inserts the events. The {@code global_sequence} column is an identity column, so the database
 * allocates the global order inside the appending transaction. Subclasses supply the
 * insert-if-absent statement for the stream row.
 *
 * <p>Register custom implementations via
 * {@code META-INF/services/eventlog.jdbc.store.AbstractJdbcEventLogStore}.
 *
 * @see JdbcEventLogStores
 */
public abstract class AbstractJdbcEventLogStore implements EventLogStore {

  private final String streamTable;
  private final String eventTable;
  private final JsonCodec jsonCodec;

  protected AbstractJdbcEventLogStore() {
    this(TableNames.STREAM_TABLE, TableNames.EVENT_TABLE, JsonCodec.getDefault());
  }

  protected AbstractJdbcEventLogStore(String streamTable, String eventTable) {
    this(streamTable, eventTable, JsonCodec.getDefault());
  }

  protected AbstractJdbcEventLogStore(String streamTable, String eventTable, JsonCodec jsonCodec) {
    this.streamTable = TableNames.validate(streamTable);
    this.eventTable = TableNames.validate(eventTable);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect using the given tables.
   */
  public abstract AbstractJdbcEventLogStore withTables(String streamTable, String eventTable);

  /**
   * Returns a store of the same dialect using the given metadata codec.
   */
  public abstract AbstractJdbcEventLogStore withJsonCodec(JsonCodec jsonCodec);

  /**
   * Inserts a stream row at version 0 unless one already exists for the aggregate.
   * Must not fail when a concurrent transaction inserts the same aggregate first.
   */
  protected abstract void insertStreamIfAbsent(Connection conn, String streamId, String aggregateType,
      String aggregateId, Timestamp now);

  protected String streamTable() {
    return streamTable;
  }

  protected String eventTable() {
    return eventTable;
  }

  protected JsonCodec jsonCodec() {
    return jsonCodec;
  }

  @Override
  public String append(Connection conn, String aggregateType, String aggregateId,
      long expectedVersion, List<NewEvent> events) {
    Timestamp now = Timestamp.from(Instant.now());
    EventStream stream;
    try {
      insertStreamIfAbsent(conn, newStreamId(), aggregateType, aggregateId, now);
      stream = lockStream(conn, aggregateType, aggregateId)
          .orElseThrow(() -> new EventStoreException(
              "Stream row for " + aggregateType + "/" + aggregateId + " missing after insert"));
    } catch (EventStoreException e) {
      // MySQL may pick a racing first append as deadlock victim (40001)
      if (JdbcTemplate.isConflict(e)) {
        throw conflictAfterRace(conn, aggregateType, aggregateId, expectedVersion, e);
      }
      throw e;
    }
    long current = stream.version();
    if (current != expectedVersion) {
      throw new ConcurrencyConflictException(aggregateType, aggregateId, expectedVersion, current);
    }

    rejectStoredEventIds(conn, events);

    long newVersion = current + events.size();
    int updated = JdbcTemplate.update(conn,
        "UPDATE " + streamTable + " SET version=?, updated_at=? WHERE stream_id=? AND version=?",
        newVersion, now, stream.streamId(), current);
    if (updated != 1) {
      throw conflictAfterRace(conn, aggregateType, aggregateId, expectedVersion, null);
    }

    try {
      insertEvents(conn, stream.streamId(), current, events);
    } catch (EventStoreException e) {
      if (JdbcTemplate.isConflict(e)) {
        throw conflictAfterRace(conn, aggregateType, aggregateId, expectedVersion, e);
      }
      throw e;
    }
    return stream.streamId();
  }

  protected Optional<EventStream> lockStream(Connection conn, String aggregateType, String aggregateId) {
    String sql = "SELECT stream_id, aggregate_type, aggregate_id, version, created_at, updated_at FROM "
        + streamTable + " WHERE aggregate_type=? AND aggregate_id=? FOR UPDATE";
    return JdbcTemplate.query(conn, sql, AbstractJdbcEventLogStore::mapStream, aggregateType, aggregateId)
        .stream().findFirst();
  }

  private void rejectStoredEventIds(Connection conn, List<NewEvent> events) {
    StringJoiner placeholders = new StringJoiner(",", "(", ")");
    Object[] ids = new Object[events.size()];
    for (int i = 0; i < ids.length; i++) {
      placeholders.add("?");
      ids[i] = events.get(i).eventId();
    }
    List<String> stored = JdbcTemplate.query(conn,
        "SELECT event_id FROM " + eventTable + " WHERE event_id IN " + placeholders,
        rs -> rs.getString(1), ids);
    if (!stored.isEmpty()) {
      throw new EventStoreException("Event ids already stored: " + stored);
    }
  }

  protected void insertEvents(Connection conn, String streamId, long currentVersion, List<NewEvent> events) {
    String sql = "INSERT INTO " + eventTable + " (" +
        "event_id, stream_id, event_type, event_schema_version, aggregate_version, " +
        "payload, metadata, occurred_at, causation_id, correlation_id, user_id" +
        ") VALUES (?,?,?,?,?,?,?,?,?,?,?)";
    List<Object[]> rows = new ArrayList<>(events.size());
    long version = currentVersion;
    for (NewEvent event : events) {
      version++;
      rows.add(new Object[]{
          event.eventId(), streamId, event.eventType(), event.eventSchemaVersion(), version,
          event.payloadJson(), jsonCodec.toJson(event.metadata()), Timestamp.from(event.occurredAt()),
          event.causationId(), event.correlationId(), event.userId()});
    }
    JdbcTemplate.batchUpdate(conn, sql, rows);
  }

  @Override
  public Optional<EventStream> findStream(Connection conn, String aggregateType, String aggregateId) {
    String sql = "SELECT stream_id, aggregate_type, aggregate_id, version, created_at, updated_at FROM "
        + streamTable + " WHERE aggregate_type=? AND aggregate_id=?";
    return JdbcTemplate.query(conn, sql, AbstractJdbcEventLogStore::mapStream, aggregateType, aggregateId)
        .stream().findFirst();
  }

  @Override
  public List<DomainEvent> readStream(Connection conn, String aggregateType, String aggregateId,
      long afterVersion) {
    String sql = selectEvents() +
        " WHERE s.aggregate_type=? AND s.aggregate_id=? AND e.aggregate_version>?" +
        " ORDER BY e.aggregate_version";
    return JdbcTemplate.query(conn, sql, this::mapEvent, aggregateType, aggregateId, afterVersion);
  }

  @Override
  public List<DomainEvent> eventsAfter(Connection conn, Long cursor, int limit) {
    String sql = selectEvents() + " WHERE e.global_sequence>? ORDER BY e.global_sequence LIMIT ?";
    return JdbcTemplate.query(conn, sql, this::mapEvent, cursorValue(cursor), limit);
  }

  @Override
  public OptionalLong latestSequence(Connection conn) {
    String sql = "SELECT MAX(global_sequence) FROM " + eventTable;
    List<OptionalLong> result = JdbcTemplate.query(conn, sql, rs -> {
      long max = rs.getLong(1);
      return rs.wasNull() ? OptionalLong.empty() : OptionalLong.of(max);
    });
    return result.isEmpty() ? OptionalLong.empty() : result.get(0);
  }

  @Override
  public long countAfter(Connection conn, Long cursor) {
    String sql = "SELECT COUNT(*) FROM " + eventTable + " WHERE global_sequence>?";
    return JdbcTemplate.query(conn, sql, rs -> rs.getLong(1), cursorValue(cursor)).get(0);
  }

  @Override
  public List<DomainEvent> eventsByCorrelationId(Connection conn, String correlationId) {
    String sql = selectEvents() + " WHERE e.correlation_id=? ORDER BY e.global_sequence";
    return JdbcTemplate.query(conn, sql, this::mapEvent, correlationId);
  }

  private String selectEvents() {
    return "SELECT e.global_sequence, e.event_id, e.stream_id, s.aggregate_type, s.aggregate_id, " +
        "e.event_type, e.event_schema_version, e.aggregate_version, e.payload, e.metadata, " +
        "e.occurred_at, e.causation_id, e.correlation_id, e.user_id " +
        "FROM " + eventTable + " e JOIN " + streamTable + " s ON s.stream_id = e.stream_id";
  }

  private ConcurrencyConflictException conflictAfterRace(Connection conn, String aggregateType,
      String aggregateId, long expectedVersion, Exception cause) {
    long actual = -1;
    try {
      actual = findStream(conn, aggregateType, aggregateId).map(EventStream::version).orElse(0L);
    } catch (EventStoreException e) {
      // PostgreSQL refuses further statements once a constraint violation aborted the transaction
      if (cause != null) {
        cause.addSuppressed(e);
      }
    }
    return new ConcurrencyConflictException(aggregateType, aggregateId, expectedVersion, actual, cause);
  }

  private DomainEvent mapEvent(ResultSet rs) throws SQLException {
    return new DomainEvent(
        rs.getString("event_id"),
        rs.getString("stream_id"),
        rs.getString("aggregate_type"),
        rs.getString("aggregate_id"),
        rs.getString("event_type"),
        rs.getInt("event_schema_version"),
        rs.getLong("aggregate_version"),
        rs.getString("payload"),
        jsonCodec.parseObject(rs.getString("metadata")),
        rs.getTimestamp("occurred_at").toInstant(),
        rs.getString("causation_id"),
        rs.getString("correlation_id"),
        rs.getString("user_id"),
        rs.getLong("global_sequence"));
  }

  private static EventStream mapStream(ResultSet rs) throws SQLException {
    return new EventStream(
        rs.getString("stream_id"),
        rs.getString("aggregate_type"),
        rs.getString("aggregate_id"),
        rs.getLong("version"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant());
  }

  private static long cursorValue(Long cursor) {
    return cursor == null ? 0L : cursor;
  }

  private static String newStreamId() {
    return UlidCreator.getMonotonicUlid().toString();
  }
}
