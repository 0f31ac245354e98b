package eventlog.spring.boot;

import eventlog.projection.ProjectionManager;

import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * Registers {@link ProjectionHealthIndicator} when Spring Boot Actuator is present.
 */
@AutoConfiguration(after = EventLogAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnBean(ProjectionManager.class)
public class EventLogHealthAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(name = "projectionsHealthIndicator")
  public ProjectionHealthIndicator projectionsHealthIndicator(ProjectionManager projectionManager) {
    return new ProjectionHealthIndicator(projectionManager);
  }
}
