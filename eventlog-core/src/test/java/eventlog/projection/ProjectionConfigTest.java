package eventlog.projection;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ProjectionConfigTest {

  @Test
  void defaults() {
    ProjectionConfig config = ProjectionConfig.defaults();

    assertEquals(100, config.batchSize());
    assertEquals(Duration.ofSeconds(1), config.pollInterval());
    assertEquals(3, config.maxRetries());
    assertEquals(Duration.ofMillis(100), config.initialRetryDelay());
    assertEquals(2.0, config.retryBackoffMultiplier());
    assertEquals(Duration.ofSeconds(5), config.maxRetryDelay());
    assertEquals(100, config.lagWarningThreshold());
    assertEquals(1000, config.lagErrorThreshold());
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> ProjectionConfig.builder().batchSize(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> ProjectionConfig.builder().pollInterval(Duration.ZERO).build());
    assertThrows(IllegalArgumentException.class, () -> ProjectionConfig.builder().maxRetries(-1).build());
    assertThrows(IllegalArgumentException.class,
        () -> ProjectionConfig.builder().retryBackoffMultiplier(0.9).build());
    assertThrows(IllegalArgumentException.class,
        () -> ProjectionConfig.builder().maxRetryDelay(Duration.ofMillis(10)).build());
    assertThrows(IllegalArgumentException.class,
        () -> ProjectionConfig.builder().lagWarningThreshold(500).lagErrorThreshold(100).build());
    assertThrows(NullPointerException.class, () -> ProjectionConfig.builder().pollInterval(null).build());
  }

  @Test
  void rejectsSubMillisecondRetryDelay() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ProjectionConfig.builder().initialRetryDelay(Duration.ofNanos(500_000)).build());
    assertTrue(ex.getMessage().contains("initialRetryDelay"), ex.getMessage());
    assertThrows(IllegalArgumentException.class,
        () -> ProjectionConfig.builder().initialRetryDelay(Duration.ZERO).build());

    ProjectionConfig config = ProjectionConfig.builder().initialRetryDelay(Duration.ofMillis(1)).build();
    assertEquals(1L, ExponentialBackoffRetryPolicy.from(config).computeDelayMs(1));
  }
}
