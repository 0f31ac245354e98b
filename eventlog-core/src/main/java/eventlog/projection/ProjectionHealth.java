package eventlog.projection;

import java.time.Instant;

/**
 * Lag-based health of one projection.
 *
 * @param projectionName  projection name
 * @param healthy         {@code true} while lag is below the error threshold
 * @param lag             events not yet applied
 * @param lastProcessedAt time of the last applied event, or {@code null} if none
 * @param message         human-readable grading of the lag
 */
public record ProjectionHealth(
        String projectionName,
        boolean healthy,
        long lag,
        Instant lastProcessedAt,
        String message
) {
}
