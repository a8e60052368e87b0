/*
 * Where: Notification domain model
 * What: Row counts of notification_states by lifecycle status
 * Why: Reported in the housekeeping health summary and the stats API
 */
package com.pimapos.notification.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** {@code dismissed} includes {@code expired}; expired rows are auto-dismissed ones. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationStats(long total, long pending, long handled, long dismissed, long expired) {}
