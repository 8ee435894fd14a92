package mailsched.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import mailsched.micrometer.MicrometerMetricsExporter;
import mailsched.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code mailsched.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link MailScheduleAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the pipeline.
 */
@AutoConfiguration(before = MailScheduleAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "mailsched.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(MailScheduleProperties.class)
public class MailScheduleMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  @ConditionalOnBean(MeterRegistry.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, MailScheduleProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
