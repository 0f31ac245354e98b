package eventlog.projection;

import java.time.Instant;

/**
 * Point-in-time view of a projection: runner lifecycle plus stored position and lag.
 */
public record ProjectionStatus(
        String projectionName,
        ProjectionState state,
        boolean running,
        String lastEventId,
        Long lastGlobalSequence,
        long eventsProcessed,
        long eventLag,
        Instant lastProcessedAt,
        String lastError,
        Instant lastErrorAt
) {
}
