/*
 * Where: Notification service layer
 * What: Micrometer counters and gauges for reconciliation, ingestion, lifecycle and housekeeping
 * Why: Reconciliation counts are the signal that the live listener is missing events
 */
package com.pimapos.notification.service;

import com.pimapos.notification.model.AuditAction;
import com.pimapos.notification.model.IngestionOutcome;
import com.pimapos.notification.model.ReconciliationResult;
import com.pimapos.notification.model.SourceFeed;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class NotificationMetrics {

  static final String METRIC_RECONCILIATION_RECORDS = "notification.reconciliation.records";
  static final String METRIC_RECONCILIATION_FEED_FAILURES =
      "notification.reconciliation.feed.failures";
  static final String METRIC_INGESTION_TOTAL = "notification.ingestion.total";
  static final String METRIC_LIFECYCLE_TRANSITIONS = "notification.lifecycle.transitions";
  static final String METRIC_HOUSEKEEPING_STAGE_FAILURES = "notification.housekeeping.stage.failures";
  static final String METRIC_PENDING_CURRENT = "notification.pending.current";

  private final MeterRegistry meterRegistry;
  private final AtomicLong pendingCurrent = new AtomicLong(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_PENDING_CURRENT, pendingCurrent, AtomicLong::get)
        .description("Pending notifications at the last health summary")
        .register(meterRegistry);
  }

  public void recordReconciliation(ReconciliationResult result) {
    incrementRecords("scanned", result.scanned());
    incrementRecords("already_notified", result.alreadyNotified());
    incrementRecords("suppressed", result.suppressedByAudit());
    incrementRecords("outside_window", result.outsideWindow());
    incrementRecords("created", result.created());
    incrementRecords("lost_race", result.lostRace());
    incrementRecords("failed", result.failed());
  }

  public void recordFeedFailure(SourceFeed feed) {
    counter(
            METRIC_RECONCILIATION_FEED_FAILURES,
            "Reconciliation passes that could not read a feed",
            Tags.of("feed", feed.wireName()))
        .increment();
  }

  public void recordIngestion(IngestionOutcome outcome) {
    counter(
            METRIC_INGESTION_TOTAL,
            "Live ingestion outcomes",
            Tags.of("outcome", outcome.name().toLowerCase(Locale.ROOT)))
        .increment();
  }

  public void recordTransition(AuditAction action) {
    recordTransitions(action, 1);
  }

  public void recordTransitions(AuditAction action, int count) {
    if (count <= 0) {
      return;
    }
    counter(
            METRIC_LIFECYCLE_TRANSITIONS,
            "Lifecycle transitions written to the audit log",
            Tags.of("action", action.name().toLowerCase(Locale.ROOT)))
        .increment(count);
  }

  public void recordStageFailure(String stage) {
    counter(
            METRIC_HOUSEKEEPING_STAGE_FAILURES,
            "Housekeeping stages that failed",
            Tags.of("stage", stage))
        .increment();
  }

  public void updatePendingCurrent(long pending) {
    pendingCurrent.set(Math.max(pending, 0));
  }

  private void incrementRecords(String outcome, int amount) {
    if (amount <= 0) {
      return;
    }
    counter(
            METRIC_RECONCILIATION_RECORDS,
            "Feed records seen by reconciliation, by outcome",
            Tags.of("outcome", outcome))
        .increment(amount);
  }

  private Counter counter(String name, String description, Tags tags) {
    final String cacheKey = name + tags;
    return counters.computeIfAbsent(
        cacheKey,
        ignored -> Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
