package herald.spring.boot;

import herald.http.HttpClientPools;
import herald.http.JsonWebhookEndpoint;
import herald.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * Registers the JSON webhook endpoint ({@code json}, {@code jsons}, {@code webhook},
 * {@code webhooks}) when {@code herald-http} is on the classpath.
 */
@AutoConfiguration(before = HeraldAutoConfiguration.class)
@ConditionalOnClass(JsonWebhookEndpoint.class)
public class HeraldHttpAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public HttpClientPools heraldHttpClientPools() {
    return new HttpClientPools();
  }

  @Bean
  public EndpointRegistryCustomizer jsonWebhookEndpoints(HttpClientPools pools,
      ObjectProvider<MetricsExporter> metricsProvider) {
    MetricsExporter metrics = metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP);
    return registry -> registry.register(() -> new JsonWebhookEndpoint(pools, metrics),
        JsonWebhookEndpoint.SCHEMES);
  }
}
