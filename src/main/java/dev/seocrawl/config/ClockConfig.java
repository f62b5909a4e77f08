package dev.seocrawl.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * UTC {@link Clock} shared by the robots cache (entry expiry) and the crawl snapshot writer (file
 * timestamps). Tests substitute a fixed or manually advanced clock.
 */
@Configuration
public class ClockConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock utcClock() {
    return Clock.systemUTC();
  }
}
