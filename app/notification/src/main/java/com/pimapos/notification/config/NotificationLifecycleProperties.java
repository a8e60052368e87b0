/*
 * Where: Notification application configuration binding
 * What: TTL, expiry sweep batch size and write retry settings
 * Why: Keep the empirical 24h TTL as configuration instead of a constant
 */
package com.pimapos.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.lifecycle")
@Validated
public record NotificationLifecycleProperties(
    @NotNull Duration ttl,
    @Positive int expiryBatchSize,
    @Positive int maxAttempts,
    @NotNull Duration retryBackoff) {

  @AssertTrue(message = "notification.lifecycle.ttl must be positive")
  public boolean isTtlPositive() {
    return ttl != null && !ttl.isZero() && !ttl.isNegative();
  }

  @AssertTrue(message = "notification.lifecycle.retry-backoff must not be negative")
  public boolean isRetryBackoffValid() {
    return retryBackoff != null && !retryBackoff.isNegative();
  }
}
