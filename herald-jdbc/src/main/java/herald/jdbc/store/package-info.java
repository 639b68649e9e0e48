/**
 * JDBC implementations of the Herald store SPIs.
 *
 * <p>{@link herald.jdbc.store.AbstractJdbcQueueStore} provides shared SQL and row mapping for
 * the queue; subclasses supply database-specific lease and purge strategies: H2 and MySQL
 * (select, then guarded per-row {@code UPDATE}) and PostgreSQL ({@code FOR UPDATE SKIP LOCKED}).
 * The scheduled job, template and metrics stores use portable SQL only.
 *
 * @see herald.jdbc.store.AbstractJdbcQueueStore
 * @see herald.jdbc.store.JdbcQueueStores
 * @see herald.jdbc.store.JdbcScheduledJobStore
 * @see herald.jdbc.store.JdbcTemplateStore
 * @see herald.jdbc.store.JdbcMetricsSampleStore
 */
package herald.jdbc.store;
