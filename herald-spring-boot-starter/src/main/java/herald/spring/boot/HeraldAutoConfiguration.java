package herald.spring.boot;

import herald.Herald;
import herald.dispatch.ExponentialBackoffRetryPolicy;
import herald.dispatch.RetryPolicy;
import herald.endpoint.EndpointRegistry;
import herald.jdbc.DataSourceConnectionProvider;
import herald.jdbc.HeraldSchema;
import herald.jdbc.store.AbstractJdbcQueueStore;
import herald.jdbc.store.JdbcMetricsSampleStore;
import herald.jdbc.store.JdbcQueueStores;
import herald.jdbc.store.JdbcScheduledJobStore;
import herald.jdbc.store.JdbcTemplateStore;
import herald.metrics.MetricsRecorder;
import herald.queue.NotificationQueue;
import herald.schedule.CronScheduler;
import herald.spi.ConnectionProvider;
import herald.spi.MetricsExporter;
import herald.spi.MetricsSampleStore;
import herald.spi.ScheduledJobStore;
import herald.spi.TemplateStore;
import herald.template.TemplateEngine;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for Herald.
 *
 * <p>Wires a {@link Herald} composite from a {@link DataSource} and {@link HeraldProperties}:
 * the queue store matching the database, the job, template and metrics stores, an
 * {@link EndpointRegistry} filled by {@link EndpointRegistryCustomizer} beans, and the optional
 * {@link MetricsExporter}.
 *
 * @see HeraldProperties
 * @see HeraldHttpAutoConfiguration
 * @see HeraldMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Herald.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(HeraldProperties.class)
public class HeraldAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcQueueStore queueStore(DataSource dataSource, HeraldProperties props) {
    if (props.getJdbc().isInitializeSchema()) {
      HeraldSchema.install(dataSource);
    }
    return JdbcQueueStores.detect(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(ScheduledJobStore.class)
  public JdbcScheduledJobStore scheduledJobStore() {
    return new JdbcScheduledJobStore();
  }

  @Bean
  @ConditionalOnMissingBean(TemplateStore.class)
  public JdbcTemplateStore templateStore() {
    return new JdbcTemplateStore();
  }

  @Bean
  @ConditionalOnMissingBean(MetricsSampleStore.class)
  public JdbcMetricsSampleStore metricsSampleStore() {
    return new JdbcMetricsSampleStore();
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public EndpointRegistry endpointRegistry(ObjectProvider<EndpointRegistryCustomizer> customizers) {
    EndpointRegistry.Builder builder = EndpointRegistry.builder();
    customizers.orderedStream().forEach(customizer -> customizer.customize(builder));
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Herald herald(HeraldProperties props,
      ConnectionProvider connectionProvider,
      AbstractJdbcQueueStore queueStore,
      ScheduledJobStore jobStore,
      TemplateStore templateStore,
      MetricsSampleStore sampleStore,
      EndpointRegistry endpointRegistry,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<RetryPolicy> retryPolicyProvider) {

    var processor = props.getProcessor();
    var retry = props.getRetry();
    var purge = props.getPurge();
    var builder = Herald.builder()
        .connectionProvider(connectionProvider)
        .queueStore(queueStore)
        .jobStore(jobStore)
        .templateStore(templateStore)
        .registry(endpointRegistry)
        .retryPolicy(retryPolicyProvider.getIfAvailable(ExponentialBackoffRetryPolicy::new))
        .zone(props.getScheduler().getZone())
        .processorEnabled(processor.isEnabled())
        .processingInterval(processor.getInterval())
        .batchSize(processor.getBatchSize())
        .workerCount(processor.getWorkerCount())
        .jobTimeout(processor.getJobTimeout())
        .leaseTimeout(processor.getLeaseTimeout())
        .maxConcurrency(processor.getMaxConcurrency())
        .maxRetries(retry.getMaxRetries())
        .retryDelay(retry.getRetryDelay())
        .schedulerEnabled(props.getScheduler().isEnabled())
        .purgeEnabled(purge.isEnabled())
        .purgeInterval(purge.getInterval())
        .jobRetention(purge.getJobRetention())
        .metricsRetention(purge.getMetricsRetention())
        .purgeBatchSize(purge.getBatchSize())
        .installDefaultTemplates(props.getTemplates().isInstallDefaults());
    if (props.getMetrics().isEnabled()) {
      builder.sampleStore(sampleStore);
      MetricsExporter metrics = metricsProvider.getIfAvailable();
      if (metrics != null) {
        builder.metricsExporter(metrics);
      }
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public NotificationQueue notificationQueue(Herald herald) {
    return herald.queue();
  }

  // closed by Herald
  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean
  public CronScheduler cronScheduler(Herald herald) {
    return herald.scheduler();
  }

  @Bean
  @ConditionalOnMissingBean
  public TemplateEngine templateEngine(Herald herald) {
    return herald.templates();
  }

  @Bean
  @ConditionalOnMissingBean
  public MetricsRecorder metricsRecorder(Herald herald) {
    return herald.metrics();
  }
}
