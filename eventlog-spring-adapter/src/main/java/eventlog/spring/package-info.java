/**
 * Spring transaction integration: appends join the caller's {@code @Transactional} work.
 */
package eventlog.spring;
