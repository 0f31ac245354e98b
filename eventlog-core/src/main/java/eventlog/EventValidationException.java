package eventlog;

/**
 * Thrown when append input is rejected before any storage access.
 */
public final class EventValidationException extends IllegalArgumentException {
    public EventValidationException(String message) {
        super(message);
    }
}
