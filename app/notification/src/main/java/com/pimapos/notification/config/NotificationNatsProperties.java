/*
 * Where: Notification application configuration binding
 * What: JetStream stream and durable consumer settings for live transaction inserts
 * Why: A message that exhausts its deliveries is only recovered by reconciliation
 */
package com.pimapos.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "notification.nats")
public record NotificationNatsProperties(
    @NotBlank String subject,
    @NotBlank String stream,
    @NotBlank String durable,
    Duration duplicateWindow,
    Duration ackWait,
    @Positive int maxDeliver,
    @Positive int maxAckPending) {

  /** Worst-case time a live event can spend being redelivered before JetStream gives up. */
  public Duration redeliveryBudget() {
    return ackWait.multipliedBy(maxDeliver);
  }

  @AssertTrue(message = "notification.nats.duplicate-window and ack-wait must be positive")
  public boolean isWindowsPositive() {
    return positive(duplicateWindow) && positive(ackWait);
  }

  private static boolean positive(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
