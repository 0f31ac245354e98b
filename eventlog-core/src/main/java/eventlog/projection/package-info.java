/**
 * Projection engine: replays the event log into read models.
 *
 * <p>A {@link eventlog.projection.Projector} applies events to one read model.
 * The {@link eventlog.projection.ProjectionOrchestrator} feeds it batches in global
 * sequence order with retry and durable position tracking, the
 * {@link eventlog.projection.ProjectionRunner} drives the orchestrator from a
 * scheduled poll loop, and the {@link eventlog.projection.ProjectionManager}
 * administers runners by name.
 *
 * <p>Delivery is at-least-once: a crash between a projector's write and the position
 * update redelivers the event, so projectors must be idempotent.
 */
package eventlog.projection;
