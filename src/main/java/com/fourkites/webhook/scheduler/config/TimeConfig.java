package com.fourkites.webhook.scheduler.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single time source for the service. Cron next-run estimates, {@code next_send_at} and the
 * entity audit columns are all computed in UTC from this clock; tests swap in a fixed one.
 */
@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
