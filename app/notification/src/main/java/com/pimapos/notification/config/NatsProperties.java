/*
 * Where: Notification application configuration binding
 * What: Connection settings for the broker that carries live transaction events
 * Why: Each point-of-sale site runs its own broker; reconnects must not lose the subscription
 */
package com.pimapos.notification.config;

import jakarta.validation.constraints.AssertTrue;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "nats")
public record NatsProperties(
    boolean enabled,
    String url,
    String connectionName,
    Duration connectionTimeout,
    Duration reconnectWait,
    int maxReconnects) {

  /** Settings are only checked when the live listener is switched on. */
  @AssertTrue(message = "nats settings are invalid")
  public boolean isValid() {
    if (!enabled) {
      return true;
    }
    return url != null
        && !url.isBlank()
        && isPositive(connectionTimeout)
        && isPositive(reconnectWait)
        && maxReconnects >= -1;
  }

  private static boolean isPositive(Duration value) {
    return value != null && !value.isNegative() && !value.isZero();
  }
}
