/**
 * Event-sourced persistence: an append-only, per-aggregate versioned event log
 * with a store-wide global sequence.
 *
 * <p>{@link eventlog.EventLog} appends events under optimistic concurrency control,
 * {@link eventlog.EventQueryService} reads them back in global order, and the
 * {@link eventlog.projection} package replays them into read models.
 *
 * @see eventlog.EventLog
 * @see eventlog.EventQueryService
 * @see eventlog.projection.ProjectionRunner
 */
package eventlog;
