package eventlog.micrometer;

import eventlog.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Append meters are tagged with {@code aggregate_type}; projection meters with
 * {@code projection}. Meters for an aggregate type or projection are registered the
 * first time it reports.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventlog.append.events} events committed</li>
 *   <li>{@code eventlog.append.conflicts} appends rejected with a version conflict</li>
 *   <li>{@code eventlog.projection.events.applied} events applied by a projector</li>
 *   <li>{@code eventlog.projection.retries} failed apply attempts that were retried</li>
 *   <li>{@code eventlog.projection.errors} events given up on, failed rebuilds</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code eventlog.projection.apply.duration} time per applied event, retries included</li>
 *   <li>{@code eventlog.projection.batch.duration} time per batch</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code eventlog.projection.lag} events not yet applied</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Map<String, AppendMeters> appendMeters = new ConcurrentHashMap<>();
  private final Map<String, ProjectionMeters> projectionMeters = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "eventlog"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "eventlog");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.eventlog"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.namePrefix = namePrefix;
  }

  @Override
  public void recordAppended(String aggregateType, int eventCount) {
    if (closed) return;
    append(aggregateType).events.increment(eventCount);
  }

  @Override
  public void incrementAppendConflict(String aggregateType) {
    if (closed) return;
    append(aggregateType).conflicts.increment();
  }

  @Override
  public void recordEventApplied(String projectionName, long durationMs) {
    if (closed) return;
    ProjectionMeters meters = projection(projectionName);
    meters.applied.increment();
    meters.applyDuration.record(Duration.ofMillis(durationMs));
  }

  @Override
  public void incrementRetry(String projectionName) {
    if (closed) return;
    projection(projectionName).retries.increment();
  }

  @Override
  public void incrementError(String projectionName) {
    if (closed) return;
    projection(projectionName).errors.increment();
  }

  @Override
  public void recordLag(String projectionName, long lag) {
    if (closed) return;
    projection(projectionName).lag.set(lag);
  }

  @Override
  public void recordBatchDurationMs(String projectionName, long durationMs) {
    if (closed) return;
    projection(projectionName).batchDuration.record(Duration.ofMillis(durationMs));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the event log and its projections shut down, to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>();
    appendMeters.values().forEach(m -> meters.addAll(m.all()));
    projectionMeters.values().forEach(m -> meters.addAll(m.all()));
    appendMeters.clear();
    projectionMeters.clear();
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }

  private AppendMeters append(String aggregateType) {
    return appendMeters.computeIfAbsent(aggregateType, AppendMeters::new);
  }

  private ProjectionMeters projection(String projectionName) {
    return projectionMeters.computeIfAbsent(projectionName, ProjectionMeters::new);
  }

  private final class AppendMeters {
    final Counter events;
    final Counter conflicts;

    AppendMeters(String aggregateType) {
      events = Counter.builder(namePrefix + ".append.events")
          .description("Events appended")
          .tag("aggregate_type", aggregateType)
          .register(registry);
      conflicts = Counter.builder(namePrefix + ".append.conflicts")
          .description("Appends rejected with a version conflict")
          .tag("aggregate_type", aggregateType)
          .register(registry);
    }

    List<Meter> all() {
      return List.of(events, conflicts);
    }
  }

  private final class ProjectionMeters {
    final Counter applied;
    final Counter retries;
    final Counter errors;
    final Timer applyDuration;
    final Timer batchDuration;
    final AtomicLong lag = new AtomicLong();
    final Gauge lagGauge;

    ProjectionMeters(String projectionName) {
      applied = Counter.builder(namePrefix + ".projection.events.applied")
          .description("Events applied by the projector")
          .tag("projection", projectionName)
          .register(registry);
      retries = Counter.builder(namePrefix + ".projection.retries")
          .description("Failed apply attempts that were retried")
          .tag("projection", projectionName)
          .register(registry);
      errors = Counter.builder(namePrefix + ".projection.errors")
          .description("Events that exhausted their retries and failed rebuilds")
          .tag("projection", projectionName)
          .register(registry);
      applyDuration = Timer.builder(namePrefix + ".projection.apply.duration")
          .description("Time to apply one event, retries included")
          .tag("projection", projectionName)
          .register(registry);
      batchDuration = Timer.builder(namePrefix + ".projection.batch.duration")
          .description("Time to process one batch")
          .tag("projection", projectionName)
          .register(registry);
      lagGauge = Gauge.builder(namePrefix + ".projection.lag", lag, AtomicLong::get)
          .description("Events not yet applied")
          .tag("projection", projectionName)
          .register(registry);
    }

    List<Meter> all() {
      return List.of(applied, retries, errors, applyDuration, batchDuration, lagGauge);
    }
  }
}
