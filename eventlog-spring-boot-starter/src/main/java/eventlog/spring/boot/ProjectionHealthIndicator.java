package eventlog.spring.boot;

import eventlog.projection.ProjectionConfig;
import eventlog.projection.ProjectionHealth;
import eventlog.projection.ProjectionManager;
import eventlog.projection.ProjectionRunner;
import eventlog.projection.ProjectionState;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reports every registered projection under the {@code projections} health component.
 *
 * <p>The component is DOWN when any projection lags past its error threshold, is in
 * {@link ProjectionState#ERROR}, or cannot be inspected.
 */
public class ProjectionHealthIndicator implements HealthIndicator {
  private static final Logger logger = Logger.getLogger(ProjectionHealthIndicator.class.getName());

  private final ProjectionManager manager;

  public ProjectionHealthIndicator(ProjectionManager manager) {
    this.manager = Objects.requireNonNull(manager, "manager");
  }

  @Override
  public Health health() {
    boolean up = true;
    Map<String, Object> projections = new LinkedHashMap<>();
    for (String name : manager.names()) {
      ProjectionRunner runner = manager.runner(name);
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("projectionName", name);
      details.put("state", runner.state().name());
      details.put("running", runner.isRunning());
      try {
        ProjectionHealth health = runner.health();
        ProjectionConfig config = runner.orchestrator().config();
        details.put("eventLag", health.lag());
        details.put("lagWarningThreshold", config.lagWarningThreshold());
        details.put("lagErrorThreshold", config.lagErrorThreshold());
        details.put("lastProcessedAt",
            health.lastProcessedAt() != null ? health.lastProcessedAt().toString() : "never");
        details.put("message", health.message());
        if (!health.healthy() || runner.state() == ProjectionState.ERROR) {
          up = false;
        }
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Health check failed for projection " + name, e);
        details.put("error", String.valueOf(e.getMessage()));
        up = false;
      }
      if (runner.lastError() != null) {
        details.put("lastError", runner.lastError());
      }
      projections.put(name, details);
    }
    return (up ? Health.up() : Health.down()).withDetail("projections", projections).build();
  }
}
