package eventlog.spi;

/**
 * Observability hook for exporting event log and projection metrics to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Records a committed append.
     *
     * @param aggregateType aggregate type of the stream
     * @param eventCount    number of events appended
     */
    void recordAppended(String aggregateType, int eventCount);

    /**
     * Records an append rejected with a version conflict.
     */
    void incrementAppendConflict(String aggregateType);

    /**
     * Records one event applied by a projector and its position persisted.
     *
     * @param projectionName projection name
     * @param durationMs     time spent in the projector, including retries
     */
    void recordEventApplied(String projectionName, long durationMs);

    /**
     * Records a failed apply attempt that will be retried.
     */
    default void incrementRetry(String projectionName) {
    }

    /**
     * Records an event whose retries were exhausted, or a failed tick.
     */
    void incrementError(String projectionName);

    /**
     * Records the number of events not yet applied by a projection.
     */
    void recordLag(String projectionName, long lag);

    /**
     * Records the wall-clock duration of one batch.
     */
    default void recordBatchDurationMs(String projectionName, long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void recordAppended(String aggregateType, int eventCount) {
        }

        @Override
        public void incrementAppendConflict(String aggregateType) {
        }

        @Override
        public void recordEventApplied(String projectionName, long durationMs) {
        }

        @Override
        public void incrementError(String projectionName) {
        }

        @Override
        public void recordLag(String projectionName, long lag) {
        }
    }
}
