package com.flamingo.ai.regdocs.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the aspect behind the pipeline's {@code @Timed} timers: {@code research.run} for a
 * whole run and {@code research.plan}, {@code research.discover}, {@code research.filter} and
 * {@code research.download} for its stages. Counters are registered by the stages themselves.
 */
@Configuration
public class MetricsConfig {

  /** Aspect backing the {@code @Timed} stage timers. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry meterRegistry) {
    return new TimedAspect(meterRegistry);
  }
}
