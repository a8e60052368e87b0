/*
 * Where: Notification application configuration binding
 * What: Orphan recovery settings
 * Why: The recovery window must cover the longest plausible listener outage and is set per environment
 */
package com.pimapos.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.reconciliation")
@Validated
public record NotificationReconciliationProperties(@NotNull Duration recoveryWindow) {

  @AssertTrue(message = "notification.reconciliation.recovery-window must be positive")
  public boolean isRecoveryWindowPositive() {
    return recoveryWindow != null && !recoveryWindow.isZero() && !recoveryWindow.isNegative();
  }
}
