package eventlog.projection;

/**
 * Lifecycle state of a {@link ProjectionRunner}.
 */
public enum ProjectionState {
    STOPPED,
    STARTING,
    RUNNING,
    REBUILDING,
    ERROR
}
