/**
 * Spring Boot auto-configuration for the event log, its projections and their health.
 */
package eventlog.spring.boot;
