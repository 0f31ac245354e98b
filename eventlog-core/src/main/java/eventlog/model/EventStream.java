package eventlog.model;

import java.time.Instant;

/**
 * One event stream per aggregate instance. {@code version} equals the number of
 * events appended so far; a stream that has never been appended to does not exist.
 */
public record EventStream(
        String streamId,
        String aggregateType,
        String aggregateId,
        long version,
        Instant createdAt,
        Instant updatedAt
) {
}
