/*
 * Where: Notification domain model
 * What: Outcome of one housekeeping tick across all stages
 * Why: Logged as the health summary and returned by the manual trigger API
 */
package com.pimapos.notification.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** {@code stats} is null when the stats stage itself failed. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HousekeepingSummary(
    Instant startedAt,
    ReconciliationResult reconciliation,
    int expired,
    int purged,
    int sessionsDeleted,
    NotificationStats stats,
    List<String> failedStages) {

  public HousekeepingSummary {
    failedStages =
        failedStages == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(failedStages));
  }
}
