/*
 * Where: Notification service layer
 * What: Runs one housekeeping tick: reconcile, expire, purge, clean sessions, summarize
 * Why: Stage order matters (recover before expiring) and one failing stage must not stop the rest
 */
package com.pimapos.notification.service;

import com.google.common.annotations.VisibleForTesting;
import com.pimapos.notification.model.HousekeepingSummary;
import com.pimapos.notification.model.NotificationStats;
import com.pimapos.notification.model.ReconciliationResult;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class HousekeepingService {

  static final String STAGE_RECONCILIATION = "reconciliation";
  static final String STAGE_EXPIRY = "expiry";
  static final String STAGE_PURGE = "purge";
  static final String STAGE_SESSION_CLEANUP = "session_cleanup";
  static final String STAGE_HEALTH = "health_summary";

  private static final Logger logger = LoggerFactory.getLogger(HousekeepingService.class);

  private final NotificationReconciliationService reconciliationService;
  private final NotificationLifecycleService lifecycleService;
  private final NotificationPurgeService purgeService;
  private final UserSessionCleanupService sessionCleanupService;
  private final NotificationStateStore stateStore;
  private final NotificationMetrics metrics;
  private final Clock clock;
  private final AtomicBoolean running = new AtomicBoolean(false);

  public HousekeepingService(
      NotificationReconciliationService reconciliationService,
      NotificationLifecycleService lifecycleService,
      NotificationPurgeService purgeService,
      UserSessionCleanupService sessionCleanupService,
      NotificationStateStore stateStore,
      NotificationMetrics metrics,
      Clock clock) {
    this.reconciliationService = reconciliationService;
    this.lifecycleService = lifecycleService;
    this.purgeService = purgeService;
    this.sessionCleanupService = sessionCleanupService;
    this.stateStore = stateStore;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * Runs a tick unless one is already in progress.
   *
   * @return the summary, or empty when another tick was running
   */
  public Optional<HousekeepingSummary> runTickIfIdle() {
    if (!running.compareAndSet(false, true)) {
      logger.info("housekeeping tick skipped, previous tick still running");
      return Optional.empty();
    }
    try {
      return Optional.of(runTick());
    } finally {
      running.set(false);
    }
  }

  @VisibleForTesting
  HousekeepingSummary runTick() {
    final Instant startedAt = Instant.now(clock);
    final List<String> failedStages = new ArrayList<>();
    final ReconciliationResult reconciliation =
        runStage(
            STAGE_RECONCILIATION,
            reconciliationService::reconcile,
            ReconciliationResult.skipped(),
            failedStages);
    final int expired =
        runStage(STAGE_EXPIRY, lifecycleService::expirePastDeadline, 0, failedStages);
    final int purged = runStage(STAGE_PURGE, purgeService::purge, 0, failedStages);
    final int sessionsDeleted =
        runStage(STAGE_SESSION_CLEANUP, sessionCleanupService::cleanup, 0, failedStages);
    final NotificationStats stats = runStage(STAGE_HEALTH, stateStore::stats, null, failedStages);
    if (stats != null) {
      metrics.updatePendingCurrent(stats.pending());
    }
    final HousekeepingSummary summary =
        new HousekeepingSummary(
            startedAt, reconciliation, expired, purged, sessionsDeleted, stats, failedStages);
    logger.info(
        "housekeeping tick finished startedAt={} recovered={} expired={} purged={}"
            + " sessionsDeleted={} pending={} total={} failedStages={}",
        startedAt,
        reconciliation.created(),
        expired,
        purged,
        sessionsDeleted,
        stats == null ? "unknown" : stats.pending(),
        stats == null ? "unknown" : stats.total(),
        failedStages);
    return summary;
  }

  private <T> T runStage(String stage, Supplier<T> action, T fallback, List<String> failedStages) {
    try {
      return action.get();
    } catch (RuntimeException ex) {
      failedStages.add(stage);
      metrics.recordStageFailure(stage);
      logger.error("housekeeping stage failed stage={}", stage, ex);
      return fallback;
    }
  }
}
