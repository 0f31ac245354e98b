package eventlog.model;

import java.time.Instant;
import java.util.OptionalLong;

/**
 * Durable progress marker of one projection through the global event order.
 *
 * <p>{@link #initial(String)} stands for a projection that has not applied any event yet.
 *
 * @param projectionName     unique projection name
 * @param lastEventId        last successfully applied event, or {@code null}
 * @param lastGlobalSequence global sequence of the last applied event, or {@code null}
 * @param eventsProcessed    number of events applied since the last reset
 * @param lastProcessedAt    time of the last successful apply, or {@code null}
 */
public record ProjectionPosition(
        String projectionName,
        String lastEventId,
        Long lastGlobalSequence,
        long eventsProcessed,
        Instant lastProcessedAt
) {

    public static ProjectionPosition initial(String projectionName) {
        return new ProjectionPosition(projectionName, null, null, 0L, null);
    }

    public boolean isInitial() {
        return lastGlobalSequence == null;
    }

    public OptionalLong cursor() {
        return lastGlobalSequence == null ? OptionalLong.empty() : OptionalLong.of(lastGlobalSequence);
    }

    /**
     * Returns the position after applying {@code event} at {@code now}.
     */
    public ProjectionPosition advance(DomainEvent event, Instant now) {
        return new ProjectionPosition(projectionName, event.eventId(), event.globalSequence(),
                eventsProcessed + 1, now);
    }
}
