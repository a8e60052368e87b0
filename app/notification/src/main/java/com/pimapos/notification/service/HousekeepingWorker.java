/*
 * Where: Notification housekeeping worker
 * What: Triggers a housekeeping tick on a fixed delay
 * Why: fixedDelay never starts a tick before the previous one has finished
 */
package com.pimapos.notification.service;

import com.pimapos.notification.config.NotificationHousekeepingProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notification.housekeeping.enabled", havingValue = "true")
public class HousekeepingWorker {

  private static final Logger logger = LoggerFactory.getLogger(HousekeepingWorker.class);

  private final HousekeepingService housekeepingService;
  private final NotificationHousekeepingProperties properties;

  @PostConstruct
  void logSchedule() {
    logger.info(
        "housekeeping scheduled tickInterval={} initialDelay={}",
        properties.tickInterval(),
        properties.initialDelay());
  }

  @Scheduled(
      fixedDelayString = "${notification.housekeeping.tick-interval}",
      initialDelayString = "${notification.housekeeping.initial-delay}")
  public void run() {
    housekeepingService.runTickIfIdle();
  }
}
