package com.flamingo.ai.md2db.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Meter registry and {@code @Timed} support for the ingestion pipeline. */
@Configuration
public class MetricsConfig {

  /**
   * Fallback registry when no monitoring backend is on the classpath. Counters still accumulate
   * and are logged with each run summary.
   *
   * @return an in-process registry
   */
  @Bean
  @ConditionalOnMissingBean(MeterRegistry.class)
  public MeterRegistry meterRegistry() {
    return new SimpleMeterRegistry();
  }

  /**
   * Enables {@code @Timed} on pipeline entry points.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
