package eventlog.projection;

import java.time.Duration;

/**
 * Outcome of a projection rebuild. On failure {@code eventsProcessed} counts the events
 * applied before the error; they stay applied.
 */
public record RebuildResult(
        String projectionName,
        long eventsProcessed,
        Duration duration,
        boolean success,
        String errorMessage
) {

    static RebuildResult succeeded(String projectionName, long eventsProcessed, Duration duration) {
        return new RebuildResult(projectionName, eventsProcessed, duration, true, null);
    }

    static RebuildResult failed(String projectionName, long eventsProcessed, Duration duration,
            String errorMessage) {
        return new RebuildResult(projectionName, eventsProcessed, duration, false, errorMessage);
    }
}
