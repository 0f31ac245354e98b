package eventlog.projection;

/**
 * Thrown when a projector keeps failing on one event after all retries.
 * The projection position still points at the event before it.
 */
public final class ProjectionApplyException extends RuntimeException {
    private final String projectionName;
    private final String eventId;
    private final long globalSequence;
    private final int attempts;

    public ProjectionApplyException(String projectionName, String eventId, long globalSequence,
            int attempts, Throwable cause) {
        super("Projection " + projectionName + " failed to apply event " + eventId
                + " (global sequence " + globalSequence + ") after " + attempts + " attempt(s)"
                + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        this.projectionName = projectionName;
        this.eventId = eventId;
        this.globalSequence = globalSequence;
        this.attempts = attempts;
    }

    public String projectionName() {
        return projectionName;
    }

    public String eventId() {
        return eventId;
    }

    public long globalSequence() {
        return globalSequence;
    }

    public int attempts() {
        return attempts;
    }
}
