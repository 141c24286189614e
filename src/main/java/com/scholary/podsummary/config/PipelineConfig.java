package com.scholary.podsummary.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Shared infrastructure beans for the job registry and pipeline. */
@Configuration
public class PipelineConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
