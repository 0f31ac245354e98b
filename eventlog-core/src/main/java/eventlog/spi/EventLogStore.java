package eventlog.spi;

import eventlog.NewEvent;
import eventlog.model.DomainEvent;
import eventlog.model.EventStream;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Persistence operations for event streams and events.
 *
 * <p>All methods take an explicit {@link Connection}; transaction demarcation is the
 * caller's responsibility. Implementations throw {@link eventlog.EventStoreException}
 * for storage failures.
 *
 * @see eventlog.jdbc.store.AbstractJdbcEventLogStore
 */
public interface EventLogStore {

    /**
     * Appends {@code events} to the stream of the given aggregate, creating the stream on
     * first use. Must be called inside a transaction: the stream row stays locked until
     * the caller commits or rolls back.
     *
     * @param conn            connection with auto-commit disabled
     * @param aggregateType   aggregate type
     * @param aggregateId     aggregate identifier
     * @param expectedVersion stream version the caller based its decision on
     * @param events          events to append, in order
     * @return the stream identifier
     * @throws eventlog.ConcurrencyConflictException if the stored version differs from
     *                                               {@code expectedVersion}
     */
    String append(Connection conn, String aggregateType, String aggregateId,
            long expectedVersion, List<NewEvent> events);

    Optional<EventStream> findStream(Connection conn, String aggregateType, String aggregateId);

    /**
     * Returns the events of one stream with {@code aggregateVersion > afterVersion},
     * in aggregate version order.
     */
    List<DomainEvent> readStream(Connection conn, String aggregateType, String aggregateId, long afterVersion);

    /**
     * Returns up to {@code limit} events with a global sequence greater than {@code cursor}
     * ({@code null} means from the beginning), ascending.
     */
    List<DomainEvent> eventsAfter(Connection conn, Long cursor, int limit);

    OptionalLong latestSequence(Connection conn);

    /**
     * Counts the events with a global sequence greater than {@code cursor}
     * ({@code null} counts all events).
     */
    long countAfter(Connection conn, Long cursor);

    List<DomainEvent> eventsByCorrelationId(Connection conn, String correlationId);
}
