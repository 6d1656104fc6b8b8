package reaper.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import reaper.micrometer.MicrometerMetricsExporter;
import reaper.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code reaper.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link ReaperAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the {@link reaper.Reaper}.
 */
@AutoConfiguration(before = ReaperAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "reaper.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(ReaperProperties.class)
public class ReaperMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, ReaperProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
