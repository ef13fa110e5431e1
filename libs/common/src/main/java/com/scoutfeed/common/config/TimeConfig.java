/*
 * Where: shared Spring configuration
 * What: exposes the UTC Clock every component reads time from
 * Why: tests swap in Clock.fixed instead of sleeping
 */
package com.scoutfeed.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
