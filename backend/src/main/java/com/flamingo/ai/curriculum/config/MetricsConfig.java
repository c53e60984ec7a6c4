package com.flamingo.ai.curriculum.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import java.util.Set;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics for the outline pipeline.
 *
 * <p>Parse and sync timings come from {@code @Timed}; every meter carries the application tag so
 * runs from the CLI and the service can be told apart.
 */
@Configuration
public class MetricsConfig {

  /** Timers that publish a percentile histogram. */
  static final Set<String> HISTOGRAM_TIMERS = Set.of("outline.parse", "outline.sync");

  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> outlineCommonTags(
      @Value("${spring.application.name:curriculum-outline}") String applicationName) {
    return registry -> registry.config().commonTags("application", applicationName);
  }

  /** Large specifications parse in seconds, small ones in milliseconds; keep the spread visible. */
  @Bean
  public MeterFilter outlineTimerHistograms() {
    return new MeterFilter() {
      @Override
      public DistributionStatisticConfig configure(
          Meter.Id id, DistributionStatisticConfig config) {
        if (!HISTOGRAM_TIMERS.contains(id.getName())) {
          return config;
        }
        return DistributionStatisticConfig.builder()
            .percentilesHistogram(true)
            .percentiles(0.5, 0.95)
            .build()
            .merge(config);
      }
    };
  }
}
