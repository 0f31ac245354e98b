package eventlog.projection;

/**
 * Computes the delay before retrying a failed event apply.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * @param attempts number of failed attempts so far (1 for the first failure)
     * @return delay in milliseconds before the next attempt (non-negative)
     */
    long computeDelayMs(int attempts);
}
