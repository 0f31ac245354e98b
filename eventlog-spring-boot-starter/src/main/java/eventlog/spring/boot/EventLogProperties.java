package eventlog.spring.boot;

import eventlog.jdbc.TableNames;
import eventlog.projection.ProjectionConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the event log and its projections.
 *
 * @see EventLogAutoConfiguration
 */
@ConfigurationProperties(prefix = "eventlog")
public class EventLogProperties {

  /**
   * Store dialect ("h2", "mysql", "postgresql"). Detected from the DataSource URL when unset.
   */
  private String dialect;

  /**
   * Table holding one row per aggregate stream.
   */
  private String streamTable = TableNames.STREAM_TABLE;

  /**
   * Table holding the domain events.
   */
  private String eventTable = TableNames.EVENT_TABLE;

  /**
   * Table holding projection positions.
   */
  private String positionTable = TableNames.POSITION_TABLE;

  private final Projection projection = new Projection();
  private final Metrics metrics = new Metrics();

  public String getDialect() {
    return dialect;
  }

  public void setDialect(String dialect) {
    this.dialect = dialect;
  }

  public String getStreamTable() {
    return streamTable;
  }

  public void setStreamTable(String streamTable) {
    this.streamTable = streamTable;
  }

  public String getEventTable() {
    return eventTable;
  }

  public void setEventTable(String eventTable) {
    this.eventTable = eventTable;
  }

  public String getPositionTable() {
    return positionTable;
  }

  public void setPositionTable(String positionTable) {
    this.positionTable = positionTable;
  }

  public Projection getProjection() {
    return projection;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Projection {
    private int batchSize = ProjectionConfig.DEFAULT_BATCH_SIZE;
    private Duration pollInterval = ProjectionConfig.DEFAULT_POLL_INTERVAL;
    private int maxRetries = ProjectionConfig.DEFAULT_MAX_RETRIES;
    private Duration initialRetryDelay = ProjectionConfig.DEFAULT_INITIAL_RETRY_DELAY;
    private double retryBackoffMultiplier = ProjectionConfig.DEFAULT_RETRY_BACKOFF_MULTIPLIER;
    private Duration maxRetryDelay = ProjectionConfig.DEFAULT_MAX_RETRY_DELAY;
    private long lagWarningThreshold = ProjectionConfig.DEFAULT_LAG_WARNING_THRESHOLD;
    private long lagErrorThreshold = ProjectionConfig.DEFAULT_LAG_ERROR_THRESHOLD;

    /**
     * Start every registered projection when the application context starts.
     */
    private boolean autoStart = true;

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public Duration getPollInterval() {
      return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
    }

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public Duration getInitialRetryDelay() {
      return initialRetryDelay;
    }

    public void setInitialRetryDelay(Duration initialRetryDelay) {
      this.initialRetryDelay = initialRetryDelay;
    }

    public double getRetryBackoffMultiplier() {
      return retryBackoffMultiplier;
    }

    public void setRetryBackoffMultiplier(double retryBackoffMultiplier) {
      this.retryBackoffMultiplier = retryBackoffMultiplier;
    }

    public Duration getMaxRetryDelay() {
      return maxRetryDelay;
    }

    public void setMaxRetryDelay(Duration maxRetryDelay) {
      this.maxRetryDelay = maxRetryDelay;
    }

    public long getLagWarningThreshold() {
      return lagWarningThreshold;
    }

    public void setLagWarningThreshold(long lagWarningThreshold) {
      this.lagWarningThreshold = lagWarningThreshold;
    }

    public long getLagErrorThreshold() {
      return lagErrorThreshold;
    }

    public void setLagErrorThreshold(long lagErrorThreshold) {
      this.lagErrorThreshold = lagErrorThreshold;
    }

    public boolean isAutoStart() {
      return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
      this.autoStart = autoStart;
    }

    ProjectionConfig toConfig() {
      return ProjectionConfig.builder()
          .batchSize(batchSize)
          .pollInterval(pollInterval)
          .maxRetries(maxRetries)
          .initialRetryDelay(initialRetryDelay)
          .retryBackoffMultiplier(retryBackoffMultiplier)
          .maxRetryDelay(maxRetryDelay)
          .lagWarningThreshold(lagWarningThreshold)
          .lagErrorThreshold(lagErrorThreshold)
          .build();
    }
  }

  public static class Metrics {
    /**
     * Register Micrometer meters when a MeterRegistry is available.
     */
    private boolean enabled = true;

    /**
     * Prefix of every meter name.
     */
    private String namePrefix = "eventlog";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
