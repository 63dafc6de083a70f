package com.copytrading.engine.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {
  @Bean
  @ConditionalOnMissingBean
  public Clock copyEngineClock() {
    return Clock.systemUTC();
  }
}
