package eventlog.projection;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Administrative registry of projection runners, keyed by projection name.
 *
 * <p>Operators start, stop, rebuild and inspect projections by name. Closing the manager
 * closes every registered runner.
 */
public final class ProjectionManager implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ProjectionManager.class.getName());

    private final Map<String, ProjectionRunner> runners = new ConcurrentSkipListMap<>();

    /**
     * Registers a runner under its projection name.
     *
     * @throws IllegalArgumentException if a runner with the same name is already registered
     */
    public ProjectionManager register(ProjectionRunner runner) {
        Objects.requireNonNull(runner, "runner");
        ProjectionRunner existing = runners.putIfAbsent(runner.projectionName(), runner);
        if (existing != null) {
            throw new IllegalArgumentException("Projection already registered: " + runner.projectionName());
        }
        return this;
    }

    /**
     * @throws IllegalArgumentException if no runner is registered under {@code projectionName}
     */
    public ProjectionRunner runner(String projectionName) {
        Objects.requireNonNull(projectionName, "projectionName");
        ProjectionRunner runner = runners.get(projectionName);
        if (runner == null) {
            throw new IllegalArgumentException("Unknown projection: " + projectionName
                    + ". Registered: " + runners.keySet());
        }
        return runner;
    }

    public List<String> names() {
        return List.copyOf(runners.keySet());
    }

    public void start(String projectionName) {
        runner(projectionName).start();
    }

    public void stop(String projectionName) {
        runner(projectionName).stop();
    }

    public RebuildResult rebuild(String projectionName) {
        return runner(projectionName).rebuild();
    }

    public ProjectionStatus status(String projectionName) {
        return runner(projectionName).status();
    }

    public ProjectionHealth health(String projectionName) {
        return runner(projectionName).health();
    }

    public List<ProjectionStatus> statuses() {
        List<ProjectionStatus> result = new ArrayList<>(runners.size());
        for (ProjectionRunner runner : runners.values()) {
            result.add(runner.status());
        }
        return result;
    }

    /**
     * Starts every registered runner. A runner that fails to start does not prevent the
     * others from starting; the first failure is rethrown afterwards with the rest suppressed.
     */
    public void startAll() {
        RuntimeException first = null;
        for (ProjectionRunner runner : runners.values()) {
            try {
                runner.start();
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Failed to start projection " + runner.projectionName(), e);
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        if (first != null) {
            throw first;
        }
    }

    public void stopAll() {
        runners.values().forEach(ProjectionRunner::stop);
    }

    @Override
    public void close() {
        RuntimeException first = null;
        for (ProjectionRunner runner : runners.values()) {
            try {
                runner.close();
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        if (first != null) {
            throw first;
        }
    }
}
