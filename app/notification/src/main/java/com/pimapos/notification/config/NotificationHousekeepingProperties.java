/*
 * Where: Notification application configuration binding
 * What: Housekeeping tick schedule
 * Why: Tick interval bounds how late a recovered notification can appear
 */
package com.pimapos.notification.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.housekeeping")
public record NotificationHousekeepingProperties(
    boolean enabled, Duration tickInterval, Duration initialDelay) {}
