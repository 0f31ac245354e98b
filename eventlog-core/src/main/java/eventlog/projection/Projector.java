package eventlog.projection;

import eventlog.model.DomainEvent;
import eventlog.model.ProjectionPosition;

import java.util.Optional;

/**
 * Applies events to one read model.
 *
 * <p>Implementations must be idempotent: an event may be delivered again after a
 * crash or a retried batch. The usual approach is to record the last applied
 * aggregate version (or global sequence) on each read-model row and skip events at
 * or below it.
 */
public interface Projector {

    /**
     * Unique projection name, used as the position key. Letters, digits, {@code _} and {@code -}.
     */
    String name();

    /**
     * Applies one event. Throwing makes the orchestrator retry the same event.
     */
    void apply(DomainEvent event) throws Exception;

    /**
     * Clears the read model before a rebuild.
     */
    void reset() throws Exception;

    /**
     * Position recorded by the read model itself, if it tracks one. Lets the orchestrator
     * resume past events whose read-model write committed but whose position update did not.
     */
    default Optional<ProjectionPosition> currentPosition() {
        return Optional.empty();
    }
}
