/*
 * Where: Notification engine entry point
 * What: Boots Spring, binds configuration records and enables the housekeeping scheduler
 * Why: One process owns live ingestion, reconciliation and the dashboard API
 */
package com.pimapos.notification;

import com.pimapos.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class NotificationApplication {

  public static void main(String[] args) {
    SpringApplication.run(NotificationApplication.class, args);
  }
}
