/*
 * Where: Common configuration
 * What: Exposes the Clock as an injectable bean
 * Why: Services read "now" from one place so tests can pin time
 */
package com.pimapos.common.config;

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
