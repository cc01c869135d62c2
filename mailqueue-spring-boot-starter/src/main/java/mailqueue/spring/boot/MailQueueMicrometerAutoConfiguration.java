package mailqueue.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import mailqueue.micrometer.MicrometerMetricsExporter;
import mailqueue.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code mailqueue.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link MailQueueAutoConfiguration} so the exporter is injected into the queue,
 * webhook receiver and worker.
 */
@AutoConfiguration(before = MailQueueAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "mailqueue.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(MailQueueProperties.class)
public class MailQueueMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(MeterRegistry meterRegistry,
      MailQueueProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
