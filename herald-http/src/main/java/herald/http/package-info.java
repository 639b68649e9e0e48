/**
 * HTTP plumbing shared by endpoints: {@link herald.http.HttpClientPools} keeps one pooled
 * Apache HttpClient per service, sized by {@link herald.http.ServiceCategory}.
 *
 * <p>{@link herald.http.JsonWebhookEndpoint} is the generic JSON webhook. Register it with
 * <pre>{@code
 * EndpointRegistry.builder()
 *     .register(() -> new JsonWebhookEndpoint(HttpClientPools.shared(), exporter),
 *         JsonWebhookEndpoint.SCHEMES)
 *     .build();
 * }</pre>
 */
package herald.http;
