/*
 * Where: Notification domain model
 * What: Counters produced by one reconciliation pass
 * Why: These counts are the main observability signal for orphan recovery
 */
package com.pimapos.notification.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReconciliationResult(
    Instant cutoff,
    int scanned,
    int alreadyNotified,
    int suppressedByAudit,
    int outsideWindow,
    int created,
    int lostRace,
    int failed,
    List<SourceFeed> failedFeeds) {

  public ReconciliationResult {
    failedFeeds =
        failedFeeds == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(failedFeeds));
  }

  public static ReconciliationResult skipped() {
    return new ReconciliationResult(null, 0, 0, 0, 0, 0, 0, 0, List.of());
  }
}
