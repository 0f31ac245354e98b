package eventlog.projection;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning for one projection: batch size, poll interval, per-event retry, and lag
 * thresholds for health grading.
 *
 * <p>Create instances via {@link #builder()} or use {@link #defaults()}.
 */
public final class ProjectionConfig {
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_INITIAL_RETRY_DELAY = Duration.ofMillis(100);
    public static final double DEFAULT_RETRY_BACKOFF_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_MAX_RETRY_DELAY = Duration.ofSeconds(5);
    public static final long DEFAULT_LAG_WARNING_THRESHOLD = 100;
    public static final long DEFAULT_LAG_ERROR_THRESHOLD = 1000;

    private static final ProjectionConfig DEFAULTS = builder().build();

    private final int batchSize;
    private final Duration pollInterval;
    private final int maxRetries;
    private final Duration initialRetryDelay;
    private final double retryBackoffMultiplier;
    private final Duration maxRetryDelay;
    private final long lagWarningThreshold;
    private final long lagErrorThreshold;

    private ProjectionConfig(Builder builder) {
        this.pollInterval = Objects.requireNonNull(builder.pollInterval, "pollInterval");
        this.initialRetryDelay = Objects.requireNonNull(builder.initialRetryDelay, "initialRetryDelay");
        this.maxRetryDelay = Objects.requireNonNull(builder.maxRetryDelay, "maxRetryDelay");

        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0, got: " + builder.batchSize);
        }
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + builder.maxRetries);
        }
        if (initialRetryDelay.toMillis() < 1) {
            throw new IllegalArgumentException("initialRetryDelay must be at least 1 ms, got: " + initialRetryDelay);
        }
        if (!(builder.retryBackoffMultiplier >= 1.0)) {
            throw new IllegalArgumentException("retryBackoffMultiplier must be >= 1.0, got: "
                    + builder.retryBackoffMultiplier);
        }
        if (maxRetryDelay.compareTo(initialRetryDelay) < 0) {
            throw new IllegalArgumentException("maxRetryDelay must be >= initialRetryDelay");
        }
        if (builder.lagWarningThreshold <= 0) {
            throw new IllegalArgumentException("lagWarningThreshold must be > 0");
        }
        if (builder.lagErrorThreshold < builder.lagWarningThreshold) {
            throw new IllegalArgumentException("lagErrorThreshold must be >= lagWarningThreshold");
        }

        this.batchSize = builder.batchSize;
        this.maxRetries = builder.maxRetries;
        this.retryBackoffMultiplier = builder.retryBackoffMultiplier;
        this.lagWarningThreshold = builder.lagWarningThreshold;
        this.lagErrorThreshold = builder.lagErrorThreshold;
    }

    public static ProjectionConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int batchSize() {
        return batchSize;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Duration initialRetryDelay() {
        return initialRetryDelay;
    }

    public double retryBackoffMultiplier() {
        return retryBackoffMultiplier;
    }

    public Duration maxRetryDelay() {
        return maxRetryDelay;
    }

    public long lagWarningThreshold() {
        return lagWarningThreshold;
    }

    public long lagErrorThreshold() {
        return lagErrorThreshold;
    }

    @Override
    public String toString() {
        return "ProjectionConfig{batchSize=" + batchSize + ", pollInterval=" + pollInterval
                + ", maxRetries=" + maxRetries + ", initialRetryDelay=" + initialRetryDelay
                + ", retryBackoffMultiplier=" + retryBackoffMultiplier + ", maxRetryDelay=" + maxRetryDelay
                + ", lagWarningThreshold=" + lagWarningThreshold + ", lagErrorThreshold=" + lagErrorThreshold + '}';
    }

    /**
     * Builder for {@link ProjectionConfig}.
     */
    public static final class Builder {
        private int batchSize = DEFAULT_BATCH_SIZE;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration initialRetryDelay = DEFAULT_INITIAL_RETRY_DELAY;
        private double retryBackoffMultiplier = DEFAULT_RETRY_BACKOFF_MULTIPLIER;
        private Duration maxRetryDelay = DEFAULT_MAX_RETRY_DELAY;
        private long lagWarningThreshold = DEFAULT_LAG_WARNING_THRESHOLD;
        private long lagErrorThreshold = DEFAULT_LAG_ERROR_THRESHOLD;

        private Builder() {
        }

        /**
         * Maximum number of events read per batch.
         *
         * <p>Optional. Defaults to {@value ProjectionConfig#DEFAULT_BATCH_SIZE}.
         *
         * @param batchSize events per batch (must be positive)
         * @return this builder
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Delay between the end of one poll tick and the start of the next.
         *
         * <p>Optional. Defaults to 1 second.
         *
         * @param pollInterval the poll interval (must be positive)
         * @return this builder
         */
        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        /**
         * Retries per event after the first failed attempt. {@code 0} disables retry.
         *
         * <p>Optional. Defaults to {@value ProjectionConfig#DEFAULT_MAX_RETRIES}.
         *
         * @param maxRetries retry count (must be >= 0)
         * @return this builder
         */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Delay before the first retry.
         *
         * <p>Optional. Defaults to 100 ms.
         *
         * @param initialRetryDelay the first retry delay (must be positive)
         * @return this builder
         */
        public Builder initialRetryDelay(Duration initialRetryDelay) {
            this.initialRetryDelay = initialRetryDelay;
            return this;
        }

        /**
         * Factor applied to the retry delay after each failed attempt.
         *
         * <p>Optional. Defaults to {@value ProjectionConfig#DEFAULT_RETRY_BACKOFF_MULTIPLIER}.
         *
         * @param retryBackoffMultiplier the growth factor (must be >= 1.0)
         * @return this builder
         */
        public Builder retryBackoffMultiplier(double retryBackoffMultiplier) {
            this.retryBackoffMultiplier = retryBackoffMultiplier;
            return this;
        }

        /**
         * Upper bound for a single retry delay.
         *
         * <p>Optional. Defaults to 5 seconds.
         *
         * @param maxRetryDelay the delay cap (must be >= initial delay)
         * @return this builder
         */
        public Builder maxRetryDelay(Duration maxRetryDelay) {
            this.maxRetryDelay = maxRetryDelay;
            return this;
        }

        /**
         * Lag at which health reports the projection as behind.
         *
         * <p>Optional. Defaults to {@value ProjectionConfig#DEFAULT_LAG_WARNING_THRESHOLD}.
         *
         * @param lagWarningThreshold warning threshold in events
         * @return this builder
         */
        public Builder lagWarningThreshold(long lagWarningThreshold) {
            this.lagWarningThreshold = lagWarningThreshold;
            return this;
        }

        /**
         * Lag at which health reports the projection as unhealthy.
         *
         * <p>Optional. Defaults to {@value ProjectionConfig#DEFAULT_LAG_ERROR_THRESHOLD}.
         *
         * @param lagErrorThreshold error threshold in events
         * @return this builder
         */
        public Builder lagErrorThreshold(long lagErrorThreshold) {
            this.lagErrorThreshold = lagErrorThreshold;
            return this;
        }

        public ProjectionConfig build() {
            return new ProjectionConfig(this);
        }
    }
}
