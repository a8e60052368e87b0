/*
 * Where: Notification application configuration binding
 * What: Defaults for the read API
 * Why: The recent-pending view looks back 48h unless the caller asks otherwise
 */
package com.pimapos.notification.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.api")
public record NotificationApiProperties(Duration recentDefaultWindow) {}
