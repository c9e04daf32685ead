package com.tinytasks.api.infra;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

  // timestamps are stored and rendered in UTC
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
