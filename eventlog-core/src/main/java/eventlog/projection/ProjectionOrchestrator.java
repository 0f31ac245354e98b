package eventlog.projection;

import eventlog.EventQueryService;
import eventlog.EventStoreException;
import eventlog.model.DomainEvent;
import eventlog.model.ProjectionPosition;
import eventlog.spi.ConnectionProvider;
import eventlog.spi.EventLogStore;
import eventlog.spi.MetricsExporter;
import eventlog.spi.ProjectionPositionStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Drives one {@link Projector} through the event log in global sequence order.
 *
 * <p>Each event is applied with retry. Once the projector accepts it, the projection
 * position is persisted before the next event is touched, so a failure never loses
 * progress already made and never skips an event. An event that still fails after
 * {@link ProjectionConfig#maxRetries()} retries stops the batch with a
 * {@link ProjectionApplyException}; the next batch starts again at that event.
 *
 * <p>Not thread-safe: one caller at a time. {@link ProjectionRunner} guarantees this
 * for scheduled use.
 *
 * @see ProjectionRunner
 */
public final class ProjectionOrchestrator {
    private static final Logger logger = Logger.getLogger(ProjectionOrchestrator.class.getName());
    private static final Pattern PROJECTION_NAME = Pattern.compile("[A-Za-z0-9_-]{1,100}");

    private final ConnectionProvider connectionProvider;
    private final EventQueryService queryService;
    private final ProjectionPositionStore positionStore;
    private final Projector projector;
    private final ProjectionConfig config;
    private final RetryPolicy retryPolicy;
    private final MetricsExporter metrics;
    private final String projectionName;

    private ProjectionOrchestrator(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        EventLogStore eventLogStore = Objects.requireNonNull(builder.eventLogStore, "eventLogStore");
        this.positionStore = Objects.requireNonNull(builder.positionStore, "positionStore");
        this.projector = Objects.requireNonNull(builder.projector, "projector");
        this.projectionName = Objects.requireNonNull(projector.name(), "projector.name()");
        if (!PROJECTION_NAME.matcher(projectionName).matches()) {
            throw new IllegalArgumentException("Invalid projection name: " + projectionName);
        }
        this.config = builder.config != null ? builder.config : ProjectionConfig.defaults();
        this.retryPolicy = builder.retryPolicy != null
                ? builder.retryPolicy : ExponentialBackoffRetryPolicy.from(config);
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.queryService = new EventQueryService(connectionProvider, eventLogStore);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String projectionName() {
        return projectionName;
    }

    public ProjectionConfig config() {
        return config;
    }

    /**
     * Applies up to {@code batchSize} events after the stored position.
     *
     * @return number of events applied; fewer than {@code batchSize} means caught up
     * @throws ProjectionApplyException if an event fails on every attempt
     * @throws EventStoreException      if reading events or saving the position fails
     */
    public int processBatch() {
        return processBatch(new AtomicLong());
    }

    /**
     * Processes batches until one comes back short.
     *
     * @return total number of events applied
     * @throws ProjectionApplyException on the first event that cannot be applied
     */
    public long processToCaughtUp() {
        AtomicLong applied = new AtomicLong();
        catchUp(applied);
        return applied.get();
    }

    /**
     * Clears the read model, forgets the stored position and replays the whole log.
     *
     * <p>Must not run concurrently with polling of the same projection. Failures are
     * reported in the result rather than thrown; events applied before the failure stay applied.
     */
    public RebuildResult rebuild() {
        logger.log(Level.INFO, "Rebuilding projection {0}", projectionName);
        long startNanos = System.nanoTime();
        AtomicLong applied = new AtomicLong();
        try {
            projector.reset();
            withConnection("reset position", conn -> positionStore.delete(conn, projectionName));
            catchUp(applied);
            Duration duration = elapsed(startNanos);
            logger.log(Level.INFO, "Rebuilt projection {0}: {1} events in {2} ms",
                    new Object[]{projectionName, applied.get(), duration.toMillis()});
            return RebuildResult.succeeded(projectionName, applied.get(), duration);
        } catch (Exception e) {
            Duration duration = elapsed(startNanos);
            logger.log(Level.SEVERE, "Rebuild of projection " + projectionName + " failed after "
                    + applied.get() + " events", e);
            if (!(e instanceof ProjectionApplyException)) {
                // exhausted retries were already counted when the event gave up
                metrics.incrementError(projectionName);
            }
            return RebuildResult.failed(projectionName, applied.get(), duration, describe(e));
        }
    }

    /**
     * Grades the projection by how many events it has not applied yet.
     */
    public ProjectionHealth health() {
        ProjectionPosition position = position();
        long lag = lag(position);
        boolean healthy = lag < config.lagErrorThreshold();
        return new ProjectionHealth(projectionName, healthy, lag, position.lastProcessedAt(), describeLag(lag));
    }

    /**
     * Returns the number of events after the current position and publishes it as a metric.
     */
    public long lag() {
        return lag(position());
    }

    /**
     * Returns the effective position: the stored one, or the projector's own if it is further ahead.
     */
    public ProjectionPosition position() {
        ProjectionPosition stored = withConnection("read position",
                conn -> positionStore.find(conn, projectionName))
                .orElseGet(() -> ProjectionPosition.initial(projectionName));
        return projector.currentPosition()
                .filter(own -> isAhead(own, stored))
                .map(own -> new ProjectionPosition(projectionName, own.lastEventId(), own.lastGlobalSequence(),
                        Math.max(own.eventsProcessed(), stored.eventsProcessed()), own.lastProcessedAt()))
                .orElse(stored);
    }

    private void catchUp(AtomicLong applied) {
        while (true) {
            int count = processBatch(applied);
            if (count < config.batchSize()) {
                return;
            }
        }
    }

    private int processBatch(AtomicLong applied) {
        long batchStart = System.nanoTime();
        ProjectionPosition position = position();
        List<DomainEvent> events = queryService.eventsAfter(position.lastGlobalSequence(), config.batchSize());
        if (events.isEmpty()) {
            return 0;
        }
        int count = 0;
        for (DomainEvent event : events) {
            long eventStart = System.nanoTime();
            applyWithRetry(event);
            position = position.advance(event, Instant.now());
            ProjectionPosition next = position;
            withConnection("save position", conn -> {
                positionStore.save(conn, next);
                return null;
            });
            metrics.recordEventApplied(projectionName, elapsed(eventStart).toMillis());
            applied.incrementAndGet();
            count++;
        }
        metrics.recordBatchDurationMs(projectionName, elapsed(batchStart).toMillis());
        logger.log(Level.FINE, "Projection {0} applied {1} events up to global sequence {2}",
                new Object[]{projectionName, count, position.lastGlobalSequence()});
        return count;
    }

    private void applyWithRetry(DomainEvent event) {
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                projector.apply(event);
                return;
            } catch (Exception e) {
                if (attempts > config.maxRetries()) {
                    metrics.incrementError(projectionName);
                    logger.log(Level.SEVERE, "Projection " + projectionName + " gave up on event "
                            + event.eventId() + " after " + attempts + " attempts", e);
                    throw new ProjectionApplyException(projectionName, event.eventId(),
                            event.globalSequence(), attempts, e);
                }
                long delayMs = retryPolicy.computeDelayMs(attempts);
                metrics.incrementRetry(projectionName);
                logger.log(Level.WARNING, "Projection " + projectionName + " failed on event "
                        + event.eventId() + " (attempt " + attempts + "), retrying in " + delayMs + " ms", e);
                pause(delayMs, event, attempts, e);
            }
        }
    }

    private void pause(long delayMs, DomainEvent event, int attempts, Exception failure) {
        try {
            TimeUnit.MILLISECONDS.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            ProjectionApplyException ex = new ProjectionApplyException(projectionName, event.eventId(),
                    event.globalSequence(), attempts, failure);
            ex.addSuppressed(ie);
            throw ex;
        }
    }

    private long lag(ProjectionPosition position) {
        long lag = queryService.countAfter(position.lastGlobalSequence());
        metrics.recordLag(projectionName, lag);
        return lag;
    }

    String describeLag(long lag) {
        if (lag == 0) {
            return "Projection is current";
        }
        if (lag < config.lagWarningThreshold()) {
            return "Projection is slightly behind (" + lag + " events)";
        }
        if (lag < config.lagErrorThreshold()) {
            return "Projection is behind (" + lag + " events) - WARNING";
        }
        return "Projection is significantly behind (" + lag + " events) - ERROR";
    }

    private static boolean isAhead(ProjectionPosition candidate, ProjectionPosition stored) {
        if (candidate.lastGlobalSequence() == null) {
            return false;
        }
        return stored.lastGlobalSequence() == null || candidate.lastGlobalSequence() > stored.lastGlobalSequence();
    }

    private <T> T withConnection(String operation, Function<Connection, T> action) {
        try (Connection conn = connectionProvider.getConnection()) {
            return action.apply(conn);
        } catch (SQLException e) {
            throw new EventStoreException("Projection " + projectionName + " failed to " + operation, e);
        }
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }

    /**
     * Builder for {@link ProjectionOrchestrator}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private EventLogStore eventLogStore;
        private ProjectionPositionStore positionStore;
        private Projector projector;
        private ProjectionConfig config;
        private RetryPolicy retryPolicy;
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * Sets the connection source for event reads and position writes.
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
         * <b>Required.</b>
         *
         * @param eventLogStore the store events are read from
         * @return this builder
         */
        public Builder eventLogStore(EventLogStore eventLogStore) {
            this.eventLogStore = eventLogStore;
            return this;
        }

        /**
         * <b>Required.</b>
         *
         * @param positionStore the store holding projection positions
         * @return this builder
         */
        public Builder positionStore(ProjectionPositionStore positionStore) {
            this.positionStore = positionStore;
            return this;
        }

        /**
         * <b>Required.</b>
         *
         * @param projector the read-model projector to drive
         * @return this builder
         */
        public Builder projector(Projector projector) {
            this.projector = projector;
            return this;
        }

        /**
         * Optional. Defaults to {@link ProjectionConfig#defaults()}.
         *
         * @param config batch, retry and lag settings
         * @return this builder
         */
        public Builder config(ProjectionConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Overrides the retry delay computation.
         *
         * <p>Optional. Defaults to an {@link ExponentialBackoffRetryPolicy} built from the config.
         * The number of retries always comes from {@link ProjectionConfig#maxRetries()}.
         *
         * @param retryPolicy the retry policy
         * @return this builder
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public ProjectionOrchestrator build() {
            return new ProjectionOrchestrator(this);
        }
    }
}
