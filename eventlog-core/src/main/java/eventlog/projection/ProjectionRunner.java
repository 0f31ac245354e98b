package eventlog.projection;

import eventlog.model.ProjectionPosition;
import eventlog.util.DaemonThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps one projection up to date by polling the event log on a fixed delay.
 *
 * <p>{@link #start()} first catches up synchronously, then schedules one
 * {@link ProjectionOrchestrator#processBatch()} per tick on a dedicated daemon thread.
 * Ticks never overlap: the next one is scheduled only after the previous one finished.
 * A failed tick is logged and recorded as {@code lastError}, and polling carries on.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * <p>This class is thread-safe. {@link #start()}, {@link #stop()}, {@link #rebuild()} and
 * {@link #close()} are synchronized to prevent concurrent lifecycle transitions.
 *
 * @see ProjectionOrchestrator
 * @see ProjectionManager
 */
public final class ProjectionRunner implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ProjectionRunner.class.getName());

    private final ProjectionOrchestrator orchestrator;
    private final long pollIntervalMs;
    private final AtomicReference<ProjectionState> state = new AtomicReference<>(ProjectionState.STOPPED);
    private final ReentrantLock tickLock = new ReentrantLock();

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pollTask;
    private volatile String lastError;
    private volatile Instant lastErrorAt;
    private volatile boolean closed;

    private ProjectionRunner(Builder builder) {
        this.orchestrator = Objects.requireNonNull(builder.orchestrator, "orchestrator");
        Duration interval = builder.pollInterval != null
                ? builder.pollInterval : orchestrator.config().pollInterval();
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        this.pollIntervalMs = Math.max(1L, interval.toMillis());
    }

    public static Builder builder() {
        return new Builder();
    }

    public String projectionName() {
        return orchestrator.projectionName();
    }

    public ProjectionOrchestrator orchestrator() {
        return orchestrator;
    }

    public ProjectionState state() {
        return state.get();
    }

    public boolean isRunning() {
        return pollTask != null;
    }

    /**
     * Catches up synchronously, then starts the poll loop. No-op if already running.
     *
     * @throws RuntimeException the catch-up failure; the runner is left in {@link ProjectionState#ERROR}
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("ProjectionRunner has been closed");
        }
        if (pollTask != null) {
            return;
        }
        state.set(ProjectionState.STARTING);
        logger.log(Level.INFO, "Starting projection {0}", projectionName());
        tickLock.lock();
        try {
            long applied = orchestrator.processToCaughtUp();
            logger.log(Level.INFO, "Projection {0} caught up with {1} events", new Object[]{projectionName(), applied});
        } catch (RuntimeException e) {
            recordError(e);
            state.set(ProjectionState.ERROR);
            logger.log(Level.SEVERE, "Projection " + projectionName() + " failed to start", e);
            throw e;
        } finally {
            tickLock.unlock();
        }
        if (scheduler == null) {
            scheduler = Executors.newSingleThreadScheduledExecutor(
                    new DaemonThreadFactory("eventlog-projection-" + projectionName() + "-"));
        }
        pollTask = scheduler.scheduleWithFixedDelay(this::poll, pollIntervalMs, pollIntervalMs, TimeUnit.MILLISECONDS);
        state.set(ProjectionState.RUNNING);
    }

    /**
     * Cancels future ticks and returns to {@link ProjectionState#STOPPED}. A tick already
     * in progress runs to completion.
     */
    public synchronized void stop() {
        ScheduledFuture<?> task = pollTask;
        if (task != null) {
            task.cancel(false);
            pollTask = null;
        }
        if (state.getAndSet(ProjectionState.STOPPED) != ProjectionState.STOPPED) {
            logger.log(Level.INFO, "Stopped projection {0}", projectionName());
        }
    }

    /**
     * Stops polling, rebuilds the projection from the start of the log, and resumes polling
     * if it was running before and the rebuild succeeded.
     *
     * @return the rebuild outcome; failures are reported here, not thrown
     */
    public synchronized RebuildResult rebuild() {
        if (closed) {
            throw new IllegalStateException("ProjectionRunner has been closed");
        }
        boolean wasRunning = pollTask != null;
        stop();
        state.set(ProjectionState.REBUILDING);
        RebuildResult result;
        tickLock.lock();
        try {
            result = orchestrator.rebuild();
        } finally {
            tickLock.unlock();
        }
        if (!result.success()) {
            lastError = result.errorMessage();
            lastErrorAt = Instant.now();
            state.set(ProjectionState.ERROR);
            return result;
        }
        state.set(ProjectionState.STOPPED);
        if (wasRunning) {
            try {
                start();
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Projection " + projectionName() + " did not restart after rebuild", e);
            }
        }
        return result;
    }

    /**
     * Executes a single poll tick. Called automatically by the scheduler, but may also be
     * invoked directly for testing. Skipped while a rebuild or the start-up catch-up holds the projection.
     */
    public void poll() {
        if (closed || !tickLock.tryLock()) {
            return;
        }
        try {
            orchestrator.processBatch();
            orchestrator.lag();
        } catch (Throwable t) {
            recordError(t);
            logger.log(Level.SEVERE, "Poll tick failed for projection " + projectionName(), t);
        } finally {
            tickLock.unlock();
        }
    }

    /**
     * Returns runner state combined with the stored position and current lag.
     */
    public ProjectionStatus status() {
        ProjectionPosition position = orchestrator.position();
        long lag = orchestrator.lag();
        return new ProjectionStatus(
                projectionName(),
                state.get(),
                isRunning(),
                position.lastEventId(),
                position.lastGlobalSequence(),
                position.eventsProcessed(),
                lag,
                position.lastProcessedAt(),
                lastError,
                lastErrorAt);
    }

    public ProjectionHealth health() {
        return orchestrator.health();
    }

    public String lastError() {
        return lastError;
    }

    public Instant lastErrorAt() {
        return lastErrorAt;
    }

    /**
     * Stops polling and shuts down the scheduler thread. Idempotent.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        stop();
        closed = true;
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                scheduler.shutdownNow();
            }
        }
    }

    private void recordError(Throwable t) {
        lastError = ProjectionOrchestrator.describe(t);
        lastErrorAt = Instant.now();
    }

    /**
     * Builder for {@link ProjectionRunner}.
     */
    public static final class Builder {
        private ProjectionOrchestrator orchestrator;
        private Duration pollInterval;

        private Builder() {
        }

        /**
         * <b>Required.</b>
         *
         * @param orchestrator the orchestrator to drive
         * @return this builder
         */
        public Builder orchestrator(ProjectionOrchestrator orchestrator) {
            this.orchestrator = orchestrator;
            return this;
        }

        /**
         * Overrides the delay between ticks.
         *
         * <p>Optional. Defaults to {@link ProjectionConfig#pollInterval()} of the orchestrator.
         *
         * @param pollInterval the poll interval (must be positive)
         * @return this builder
         */
        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public ProjectionRunner build() {
            return new ProjectionRunner(this);
        }
    }
}
