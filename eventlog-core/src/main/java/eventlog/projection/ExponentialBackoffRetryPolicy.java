package eventlog.projection;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff with optional jitter.
 *
 * <p>Delay formula: {@code baseDelay * multiplier^(attempt-1)}, capped at {@code maxDelay}.
 * With a jitter factor {@code j > 0} the delay is scaled by a random factor in
 * {@code [1-j, 1+j)} and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final double multiplier;
  private final long maxDelayMs;
  private final double jitterFactor;

  /**
   * Doubling backoff without jitter.
   *
   * @param baseDelayMs delay before the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, 2.0, maxDelayMs, 0.0);
  }

  /**
   * @param baseDelayMs  delay before the first retry (milliseconds)
   * @param multiplier   growth factor per attempt (>= 1.0)
   * @param maxDelayMs   maximum delay cap (milliseconds)
   * @param jitterFactor relative jitter in {@code [0, 1)}
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, double multiplier, long maxDelayMs, double jitterFactor) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (!(multiplier >= 1.0) || Double.isInfinite(multiplier)) {
      throw new IllegalArgumentException("multiplier must be >= 1.0, got: " + multiplier);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    if (!(jitterFactor >= 0.0 && jitterFactor < 1.0)) {
      throw new IllegalArgumentException("jitterFactor must be in [0, 1), got: " + jitterFactor);
    }
    this.baseDelayMs = baseDelayMs;
    this.multiplier = multiplier;
    this.maxDelayMs = maxDelayMs;
    this.jitterFactor = jitterFactor;
  }

  /**
   * Builds the policy described by the retry settings of {@code config}.
   */
  public static ExponentialBackoffRetryPolicy from(ProjectionConfig config) {
    return new ExponentialBackoffRetryPolicy(
        config.initialRetryDelay().toMillis(),
        config.retryBackoffMultiplier(),
        config.maxRetryDelay().toMillis(),
        0.0);
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    // pow overflows to Infinity for large attempts; min() caps it
    double expDelay = baseDelayMs * Math.pow(multiplier, attempts - 1);
    double capped = Math.min(maxDelayMs, expDelay);
    if (jitterFactor > 0.0) {
      capped *= ThreadLocalRandom.current().nextDouble(1.0 - jitterFactor, 1.0 + jitterFactor);
    }
    return Math.min(maxDelayMs, Math.max(0L, (long) capped));
  }
}
