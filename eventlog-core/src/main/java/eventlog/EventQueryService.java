package eventlog;

import eventlog.model.DomainEvent;
import eventlog.model.EventStream;
import eventlog.spi.ConnectionProvider;
import eventlog.spi.EventLogStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Function;

/**
 * Read-only access to the event log.
 *
 * <p>Global reads are ordered by global sequence and never by {@code occurredAt}.
 * Each call obtains and closes its own connection. Storage failures propagate as
 * {@link EventStoreException}.
 */
public final class EventQueryService {
    private final ConnectionProvider connectionProvider;
    private final EventLogStore store;

    public EventQueryService(ConnectionProvider connectionProvider, EventLogStore store) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Returns up to {@code limit} events after {@code cursor} in ascending global sequence.
     * An empty result means the caller is caught up as of this query.
     *
     * @param cursor last global sequence already seen, or {@code null} to read from the start
     * @param limit  maximum number of events (must be positive)
     */
    public List<DomainEvent> eventsAfter(Long cursor, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got: " + limit);
        }
        return withConnection("read events", conn -> store.eventsAfter(conn, cursor, limit));
    }

    /**
     * Returns the highest global sequence in the log, or empty if the log has no events.
     */
    public OptionalLong latestSequence() {
        return withConnection("read latest sequence", store::latestSequence);
    }

    /**
     * Counts events after {@code cursor}; {@code null} counts the whole log.
     */
    public long countAfter(Long cursor) {
        return withConnection("count events", conn -> store.countAfter(conn, cursor));
    }

    public Optional<EventStream> findStream(String aggregateType, String aggregateId) {
        return withConnection("read stream", conn -> store.findStream(conn, aggregateType, aggregateId));
    }

    public boolean streamExists(String aggregateType, String aggregateId) {
        return findStream(aggregateType, aggregateId).isPresent();
    }

    /**
     * Returns all events of one aggregate in version order.
     */
    public List<DomainEvent> readStream(String aggregateType, String aggregateId) {
        return readStream(aggregateType, aggregateId, 0L);
    }

    /**
     * Returns the events of one aggregate with a version greater than {@code afterVersion},
     * for replaying on top of a snapshot.
     */
    public List<DomainEvent> readStream(String aggregateType, String aggregateId, long afterVersion) {
        if (afterVersion < 0) {
            throw new IllegalArgumentException("afterVersion must be >= 0, got: " + afterVersion);
        }
        return withConnection("read stream events",
                conn -> store.readStream(conn, aggregateType, aggregateId, afterVersion));
    }

    public List<DomainEvent> eventsByCorrelationId(String correlationId) {
        Objects.requireNonNull(correlationId, "correlationId");
        return withConnection("read correlated events", conn -> store.eventsByCorrelationId(conn, correlationId));
    }

    private <T> T withConnection(String operation, Function<Connection, T> action) {
        try (Connection conn = connectionProvider.getConnection()) {
            return action.apply(conn);
        } catch (SQLException e) {
            throw new EventStoreException("Failed to " + operation, e);
        }
    }
}
