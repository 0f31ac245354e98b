package eventlog;

import eventlog.model.EventStream;
import eventlog.spi.ConnectionProvider;
import eventlog.spi.EventLogStore;
import eventlog.spi.MetricsExporter;
import eventlog.spi.TxContext;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Primary entry point for appending events to aggregate streams.
 *
 * <p>Each {@link #appendEvents} call is atomic: either every event is written and the
 * stream version advances by the number of events, or nothing changes. When the
 * configured {@link TxContext} reports an active transaction the append joins it and
 * commits or rolls back with the caller's business writes. Otherwise the append runs in
 * its own transaction on a connection from the {@link ConnectionProvider}.
 *
 * <p>Concurrent appends to the same aggregate are serialized by the store's row lock;
 * the loser of a race fails with {@link ConcurrencyConflictException}.
 *
 * @see EventLogStore
 * @see EventQueryService
 */
public final class EventLog {
    private static final Logger logger = Logger.getLogger(EventLog.class.getName());

    public static final int MAX_AGGREGATE_TYPE_LENGTH = 64;
    public static final int MAX_AGGREGATE_ID_LENGTH = 128;

    private final ConnectionProvider connectionProvider;
    private final TxContext txContext;
    private final EventLogStore store;
    private final MetricsExporter metrics;

    private EventLog(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(builder.store, "store");
        this.txContext = builder.txContext != null ? builder.txContext : TxContext.NONE;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Appends a single event. See {@link #appendEvents}.
     */
    public String appendEvent(String aggregateType, String aggregateId, long expectedVersion, NewEvent event) {
        Objects.requireNonNull(event, "event");
        return appendEvents(aggregateType, aggregateId, expectedVersion, List.of(event));
    }

    /**
     * Appends events to the stream of an aggregate.
     *
     * @param aggregateType   aggregate type (non-empty)
     * @param aggregateId     aggregate identifier (non-empty)
     * @param expectedVersion stream version the caller last observed; {@code 0} for a new aggregate
     * @param events          events in order (non-empty)
     * @return the stream identifier
     * @throws EventValidationException      if the input is invalid; nothing is written
     * @throws ConcurrencyConflictException if the stream version is not {@code expectedVersion}
     * @throws EventStoreException          if storage fails; the transaction is rolled back
     */
    public String appendEvents(String aggregateType, String aggregateId, long expectedVersion,
            List<NewEvent> events) {
        validate(aggregateType, aggregateId, expectedVersion, events);
        List<NewEvent> batch = List.copyOf(events);

        String streamId;
        try {
            if (txContext.isTransactionActive()) {
                streamId = store.append(txContext.currentConnection(), aggregateType, aggregateId,
                        expectedVersion, batch);
            } else {
                streamId = appendInOwnTransaction(aggregateType, aggregateId, expectedVersion, batch);
            }
        } catch (ConcurrencyConflictException e) {
            metrics.incrementAppendConflict(aggregateType);
            logger.log(Level.FINE, e.getMessage());
            throw e;
        }
        metrics.recordAppended(aggregateType, batch.size());
        return streamId;
    }

    /**
     * Returns the current version of an aggregate's stream, {@code 0} if it does not exist.
     * Reads through the active transaction when there is one.
     */
    public long streamVersion(String aggregateType, String aggregateId) {
        if (txContext.isTransactionActive()) {
            return store.findStream(txContext.currentConnection(), aggregateType, aggregateId)
                    .map(EventStream::version)
                    .orElse(0L);
        }
        try (Connection conn = connectionProvider.getConnection()) {
            return store.findStream(conn, aggregateType, aggregateId)
                    .map(EventStream::version)
                    .orElse(0L);
        } catch (SQLException e) {
            throw new EventStoreException("Failed to read stream version of " + aggregateType + "/" + aggregateId, e);
        }
    }

    private String appendInOwnTransaction(String aggregateType, String aggregateId, long expectedVersion,
            List<NewEvent> events) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(false);
            try {
                String streamId = store.append(conn, aggregateType, aggregateId, expectedVersion, events);
                conn.commit();
                return streamId;
            } catch (SQLException | RuntimeException e) {
                rollback(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new EventStoreException("Failed to append events to " + aggregateType + "/" + aggregateId, e);
        }
    }

    private static void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private static void validate(String aggregateType, String aggregateId, long expectedVersion,
            List<NewEvent> events) {
        if (aggregateType == null || aggregateType.isBlank()) {
            throw new EventValidationException("aggregateType cannot be empty");
        }
        if (aggregateType.length() > MAX_AGGREGATE_TYPE_LENGTH) {
            throw new EventValidationException("aggregateType exceeds " + MAX_AGGREGATE_TYPE_LENGTH + " characters");
        }
        if (aggregateId == null || aggregateId.isBlank()) {
            throw new EventValidationException("aggregateId cannot be empty");
        }
        if (aggregateId.length() > MAX_AGGREGATE_ID_LENGTH) {
            throw new EventValidationException("aggregateId exceeds " + MAX_AGGREGATE_ID_LENGTH + " characters");
        }
        if (expectedVersion < 0) {
            throw new EventValidationException("expectedVersion must be >= 0, got: " + expectedVersion);
        }
        if (events == null || events.isEmpty()) {
            throw new EventValidationException("events cannot be empty");
        }
        Set<String> ids = new HashSet<>();
        for (NewEvent event : events) {
            if (event == null) {
                throw new EventValidationException("events cannot contain null elements");
            }
            if (!ids.add(event.eventId())) {
                throw new EventValidationException("duplicate eventId in batch: " + event.eventId());
            }
        }
    }

    /**
     * Builder for {@link EventLog}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private TxContext txContext;
        private EventLogStore store;
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * Sets the connection source for appends made outside a caller transaction.
         *
         * <p><b>Required.</b>
         *
         * @param connectionProvider the connection provider
         * @return this builder
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * Sets the transaction context whose active transaction appends should join.
         *
         * <p>Optional. Defaults to {@link TxContext#NONE}, so every append commits on its own.
         *
         * @param txContext the transaction context
         * @return this builder
         */
        public Builder txContext(TxContext txContext) {
            this.txContext = txContext;
            return this;
        }

        /**
         * Sets the persistence backend.
         *
         * <p><b>Required.</b>
         *
         * @param store the event log store
         * @return this builder
         */
        public Builder store(EventLogStore store) {
            this.store = store;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public EventLog build() {
            return new EventLog(this);
        }
    }
}
