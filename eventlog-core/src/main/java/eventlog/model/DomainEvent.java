package eventlog.model;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable persisted event as read back from the event log.
 *
 * @param eventId            unique event identifier (ULID)
 * @param streamId           owning stream identifier
 * @param aggregateType      aggregate type of the owning stream
 * @param aggregateId        aggregate identifier of the owning stream
 * @param eventType          event type name
 * @param eventSchemaVersion schema version of the payload
 * @param aggregateVersion   stream version after this event (1-based, gap-free per stream)
 * @param payload            JSON payload
 * @param metadata           flat metadata map (never {@code null})
 * @param occurredAt         business timestamp; never used for ordering
 * @param causationId        identifier of the message that caused this event, or {@code null}
 * @param correlationId      identifier correlating events of one business flow, or {@code null}
 * @param userId             acting user, or {@code null}
 * @param globalSequence     store-wide position used for projection ordering
 */
public record DomainEvent(
        String eventId,
        String streamId,
        String aggregateType,
        String aggregateId,
        String eventType,
        int eventSchemaVersion,
        long aggregateVersion,
        String payload,
        Map<String, String> metadata,
        Instant occurredAt,
        String causationId,
        String correlationId,
        String userId,
        long globalSequence
) {
    public DomainEvent {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
