package com.flamingo.ai.librarychat.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Metrics for the chat pipeline. */
@Configuration
public class MetricsConfig {

  /** Enables {@code @Timed} on retrieval and embedding calls. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Tags every meter with the site it serves, since one build is deployed per site. */
  @Bean
  public MeterRegistryCustomizer<MeterRegistry> siteTagCustomizer(
      @Value("${app.site.id:default}") String siteId) {
    return registry -> registry.config().commonTags("site", siteId);
  }
}
