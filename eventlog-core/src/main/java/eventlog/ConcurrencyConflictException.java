package eventlog;

/**
 * Thrown when an append's expected stream version does not match the stored version.
 *
 * <p>Nothing was written. Callers typically reload the aggregate, re-apply their
 * command, and append again with the new version. The event log never retries
 * a conflicting append on its own.
 */
public final class ConcurrencyConflictException extends RuntimeException {
    private final String aggregateType;
    private final String aggregateId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(String aggregateType, String aggregateId,
            long expectedVersion, long actualVersion) {
        this(aggregateType, aggregateId, expectedVersion, actualVersion, null);
    }

    public ConcurrencyConflictException(String aggregateType, String aggregateId,
            long expectedVersion, long actualVersion, Throwable cause) {
        super("Version conflict on " + aggregateType + "/" + aggregateId
                + ": expected " + expectedVersion + ", actual " + actualVersion, cause);
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String aggregateType() {
        return aggregateType;
    }

    public String aggregateId() {
        return aggregateId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    public long actualVersion() {
        return actualVersion;
    }
}
