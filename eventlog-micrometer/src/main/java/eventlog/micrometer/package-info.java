/**
 * Micrometer bridge for event log and projection metrics.
 *
 * @see eventlog.micrometer.MicrometerMetricsExporter
 */
package eventlog.micrometer;
