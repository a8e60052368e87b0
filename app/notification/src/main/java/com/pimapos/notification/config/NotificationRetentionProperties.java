/*
 * Where: Notification application configuration binding
 * What: Retention of terminal notification rows and dashboard sessions
 * Why: Terminal rows are only needed while live; the audit log keeps the permanent record
 */
package com.pimapos.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.retention")
@Validated
public record NotificationRetentionProperties(
    @NotNull Duration handledRetention,
    @NotNull Duration sessionRetention,
    @Positive int purgeBatchSize) {

  @AssertTrue(message = "notification.retention.handled-retention must be positive")
  public boolean isHandledRetentionPositive() {
    return isPositiveDuration(handledRetention);
  }

  @AssertTrue(message = "notification.retention.session-retention must be positive")
  public boolean isSessionRetentionPositive() {
    return isPositiveDuration(sessionRetention);
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
