package dev.sirchmunk.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * UTC clock shared by query deadlines, cluster timestamps and the maintenance job. Tests replace
 * it with a fixed clock.
 */
@Configuration
public class ClockConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock utcClock() {
    return Clock.systemUTC();
  }
}
