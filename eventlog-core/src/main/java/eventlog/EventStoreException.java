package eventlog;

/**
 * Unchecked exception wrapping storage failures: connection loss, SQL errors,
 * and commit or rollback failures. The surrounding transaction has been rolled back,
 * so the operation is safe to retry as a fresh call.
 */
public class EventStoreException extends RuntimeException {
    public EventStoreException(String message) {
        super(message);
    }

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
