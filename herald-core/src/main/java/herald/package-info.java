/**
 * Root API for Herald, a persistent cron-driven notification scheduler.
 *
 * <h2>Core Design</h2>
 * <p>A {@linkplain herald.schedule.CronScheduler cron scheduler} or an application call puts a
 * {@link herald.queue.QueuedJob} on the durable {@linkplain herald.queue.NotificationQueue queue}.
 * The {@linkplain herald.queue.QueueProcessor processor} leases due jobs, renders their
 * {@linkplain herald.template templates}, resolves each service URL through the
 * {@linkplain herald.endpoint.EndpointRegistry endpoint registry} and fans the
 * {@link herald.Notification} out to every endpoint concurrently. Failed jobs are retried with
 * exponential backoff; every delivery is recorded by the
 * {@linkplain herald.metrics.MetricsRecorder metrics recorder}.
 *
 * <p>Delivery is at-least-once with bounded retries. A job that reached some endpoints is
 * complete and is never retried, so endpoints do not receive duplicates from partial failures.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>herald-core</b>: model, registry, dispatcher, templates, queue, scheduler, metrics
 *       (zero external deps)</li>
 *   <li><b>herald-jdbc</b>: JDBC stores for H2, MySQL and PostgreSQL</li>
 *   <li><b>herald-http</b>: shared HTTP client pools and a JSON webhook endpoint</li>
 *   <li><b>herald-micrometer</b>: Micrometer meters</li>
 *   <li><b>herald-spring-boot-starter</b>: auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var connections = new DataSourceConnectionProvider(dataSource);
 * var registry = EndpointRegistry.builder()
 *     .register(() -> new JsonWebhookEndpoint(HttpClientPools.shared()), JsonWebhookEndpoint.SCHEMES)
 *     .build();
 *
 * try (Herald herald = Herald.builder()
 *     .connectionProvider(connections)
 *     .queueStore(JdbcQueueStores.detect(dataSource))
 *     .templateStore(new JdbcTemplateStore())
 *     .registry(registry)
 *     .build()) {
 *   herald.queue().enqueue(QueuedJob.builder(JobPayload.of("Deploy", "v1.2 is live",
 *       NotifyType.SUCCESS, List.of("jsons://hooks.example.com/deploy"))).build());
 * }
 * }</pre>
 *
 * @see herald.Herald
 * @see herald.Notification
 */
package herald;
