package herald.spring.boot;

import herald.Herald;
import herald.Notification;
import herald.NotifyType;
import herald.endpoint.DeliveryContext;
import herald.endpoint.DeliveryEndpoint;
import herald.endpoint.EndpointRegistry;
import herald.endpoint.EndpointUrl;
import herald.jdbc.DataSourceConnectionProvider;
import herald.jdbc.store.AbstractJdbcQueueStore;
import herald.jdbc.store.H2QueueStore;
import herald.metrics.MetricsRecorder;
import herald.queue.JobPayload;
import herald.queue.JobStatus;
import herald.queue.NotificationQueue;
import herald.queue.QueuedJob;
import herald.schedule.CronScheduler;
import herald.schedule.ScheduledJob;
import herald.spi.ConnectionProvider;
import herald.spi.ScheduledJobStore;
import herald.spi.TemplateStore;
import herald.template.DefaultTemplates;
import herald.template.TemplateEngine;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class HeraldAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          HeraldHttpAutoConfiguration.class,
          HeraldAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:herald_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "herald.jdbc.initialize-schema=true",
          "herald.processor.enabled=false",
          "herald.purge.enabled=false");

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertInstanceOf(H2QueueStore.class, ctx.getBean(AbstractJdbcQueueStore.class));
      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertNotNull(ctx.getBean(Herald.class));
      assertNotNull(ctx.getBean(NotificationQueue.class));
      assertNotNull(ctx.getBean(CronScheduler.class));
      assertNotNull(ctx.getBean(TemplateEngine.class));
      assertNotNull(ctx.getBean(MetricsRecorder.class));
      assertTrue(ctx.getBean(MetricsRecorder.class).isDurable());
    });
  }

  @Test
  void registersJsonWebhookSchemes() {
    runner.run(ctx -> {
      EndpointRegistry registry = ctx.getBean(EndpointRegistry.class);
      assertTrue(registry.supports("json"));
      assertTrue(registry.supports("jsons"));
      assertTrue(registry.supports("webhook"));
      assertTrue(registry.supports("webhooks"));
    });
  }

  @Test
  void appliesEndpointCustomizers() {
    runner.withUserConfiguration(CustomEndpointConfig.class).run(ctx -> {
      EndpointRegistry registry = ctx.getBean(EndpointRegistry.class);
      assertTrue(registry.supports("noop"));
      assertEquals("noop", registry.resolve("noop://anything").serviceId());
    });
  }

  @Test
  void installsDefaultTemplates() {
    runner.run(ctx -> {
      TemplateEngine templates = ctx.getBean(TemplateEngine.class);
      assertTrue(templates.get(DefaultTemplates.BACKUP_STATUS).isPresent());
    });
  }

  @Test
  void skipsDefaultTemplatesWhenDisabled() {
    runner.withPropertyValues("herald.templates.install-defaults=false").run(ctx -> {
      TemplateEngine templates = ctx.getBean(TemplateEngine.class);
      assertTrue(templates.list().isEmpty());
    });
  }

  @Test
  void processorFollowsProperty() {
    runner.run(ctx -> assertNull(ctx.getBean(Herald.class).processor()));
    runner.withPropertyValues("herald.processor.enabled=true", "herald.processor.interval=1h")
        .run(ctx -> assertNotNull(ctx.getBean(Herald.class).processor()));
  }

  @Test
  void retryDefaultsReachQueue() {
    runner.withPropertyValues("herald.retry.max-retries=5").run(ctx -> {
      NotificationQueue queue = ctx.getBean(NotificationQueue.class);
      QueuedJob job = queue.enqueue(QueuedJob.builder(JobPayload.of("Deploy", "v2 is live",
          NotifyType.INFO, List.of("json://hooks.example.com/deploy"))).build());

      assertEquals(5, job.maxRetries());
      assertEquals(JobStatus.PENDING, job.status());
    });
  }

  @Test
  void schedulerPersistsJobs() {
    runner.run(ctx -> {
      CronScheduler scheduler = ctx.getBean(CronScheduler.class);
      ScheduledJob added = scheduler.add(ScheduledJob.builder("nightly", "0 2 * * *")
          .title("Nightly")
          .body("Backups ran")
          .service("json://hooks.example.com/ops")
          .build());

      assertEquals(List.of("nightly"), scheduler.list().stream().map(ScheduledJob::name).toList());
      assertNotNull(added.nextRun());
    });
  }

  @Test
  void backsOffWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(HeraldAutoConfiguration.class))
        .run(ctx -> assertFalse(ctx.containsBean("herald")));
  }

  @Test
  void backsOffWhenHeraldDefined() {
    runner.withUserConfiguration(CustomHeraldConfig.class).run(ctx -> {
      assertSame(CustomHeraldConfig.INSTANCE, ctx.getBean(Herald.class));
    });
  }

  @Configuration
  static class CustomEndpointConfig {
    @Bean
    EndpointRegistryCustomizer noopEndpoint() {
      return registry -> registry.register(NoopEndpoint::new, "noop");
    }
  }

  @Configuration
  static class CustomHeraldConfig {
    static Herald INSTANCE;

    @Bean
    Herald herald(ConnectionProvider connectionProvider, AbstractJdbcQueueStore queueStore,
        ScheduledJobStore jobStore, TemplateStore templateStore) {
      INSTANCE = Herald.builder()
          .connectionProvider(connectionProvider)
          .queueStore(queueStore)
          .jobStore(jobStore)
          .templateStore(templateStore)
          .registry(EndpointRegistry.builder().build())
          .processorEnabled(false)
          .schedulerEnabled(false)
          .purgeEnabled(false)
          .build();
      return INSTANCE;
    }
  }

  static final class NoopEndpoint implements DeliveryEndpoint {
    @Override
    public String serviceId() {
      return "noop";
    }

    @Override
    public void parse(EndpointUrl url) {
    }

    @Override
    public void send(Notification notification, DeliveryContext ctx) {
    }

    @Override
    public int defaultPort() {
      return 0;
    }
  }
}
