/*
 * Where: Notification service layer
 * What: Recovers notifications for feed rows the live listener missed
 * Why: Live delivery is lossy; a bounded rescan closes the gap without resurrecting old work
 */
package com.pimapos.notification.service;

import com.pimapos.notification.config.NotificationReconciliationProperties;
import com.pimapos.notification.feed.TransactionFeed;
import com.pimapos.notification.feed.TransactionRecord;
import com.pimapos.notification.model.ReconciliationResult;
import com.pimapos.notification.model.SourceFeed;
import com.pimapos.notification.model.UpsertResult;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * One reconciliation pass over every registered feed.
 *
 * <p>For each feed only rows created within the recovery window are read. A row is skipped when
 * its key was ever handled, dismissed or expired (checked against the audit log, so purged rows
 * stay suppressed), when a notification already exists, or when it has aged out of the window by
 * the time it is processed. Remaining rows are created with the row's own creation time, so a
 * recovered notification expires on the same schedule as a live one.
 */
@Service
public class NotificationReconciliationService {

  static final String ORIGIN = "reconciliation";

  private static final Logger logger =
      LoggerFactory.getLogger(NotificationReconciliationService.class);

  private final List<TransactionFeed> feeds;
  private final NotificationStateStore stateStore;
  private final NotificationAuditLog auditLog;
  private final NotificationDraftFactory draftFactory;
  private final NotificationReconciliationProperties properties;
  private final NotificationMetrics metrics;
  private final Clock clock;

  public NotificationReconciliationService(
      List<TransactionFeed> feeds,
      NotificationStateStore stateStore,
      NotificationAuditLog auditLog,
      NotificationDraftFactory draftFactory,
      NotificationReconciliationProperties properties,
      NotificationMetrics metrics,
      Clock clock) {
    this.feeds = List.copyOf(feeds);
    this.stateStore = stateStore;
    this.auditLog = auditLog;
    this.draftFactory = draftFactory;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  public ReconciliationResult reconcile() {
    final Instant cutoff = Instant.now(clock).minus(properties.recoveryWindow());
    final Tally tally = new Tally();
    final List<SourceFeed> failedFeeds = new ArrayList<>();
    for (TransactionFeed feed : feeds) {
      try {
        reconcileFeed(feed, cutoff, tally);
      } catch (RuntimeException ex) {
        // a feed failure of any kind stays inside that feed
        failedFeeds.add(feed.sourceFeed());
        metrics.recordFeedFailure(feed.sourceFeed());
        logger.warn(
            "notification reconciliation skipped feed={} cutoff={}",
            feed.sourceFeed().wireName(),
            cutoff,
            ex);
      }
    }
    final ReconciliationResult result =
        new ReconciliationResult(
            cutoff,
            tally.scanned,
            tally.alreadyNotified,
            tally.suppressedByAudit,
            tally.outsideWindow,
            tally.created,
            tally.lostRace,
            tally.failed,
            failedFeeds);
    metrics.recordReconciliation(result);
    logger.info(
        "notification reconciliation finished cutoff={} scanned={} alreadyNotified={}"
            + " suppressedByAudit={} outsideWindow={} created={} lostRace={} failed={}"
            + " failedFeeds={}",
        cutoff,
        result.scanned(),
        result.alreadyNotified(),
        result.suppressedByAudit(),
        result.outsideWindow(),
        result.created(),
        result.lostRace(),
        result.failed(),
        failedFeeds);
    return result;
  }

  private void reconcileFeed(TransactionFeed feed, Instant cutoff, Tally tally) {
    final SourceFeed sourceFeed = feed.sourceFeed();
    final List<TransactionRecord> records = feed.listCreatedSince(cutoff);
    tally.scanned += records.size();
    if (records.isEmpty()) {
      return;
    }
    final Set<String> transactionIds = new LinkedHashSet<>();
    for (TransactionRecord record : records) {
      transactionIds.add(record.id());
    }
    final Set<String> suppressed = auditLog.suppressedTransactionIds(sourceFeed, transactionIds);
    final Set<String> existing = stateStore.existingTransactionIds(sourceFeed, transactionIds);
    for (TransactionRecord record : records) {
      if (suppressed.contains(record.id())) {
        tally.suppressedByAudit++;
        continue;
      }
      if (existing.contains(record.id())) {
        tally.alreadyNotified++;
        continue;
      }
      // The window moves while a long pass runs; re-check against the current time.
      final Instant freshCutoff = Instant.now(clock).minus(properties.recoveryWindow());
      if (record.createdAt().isBefore(freshCutoff)) {
        tally.outsideWindow++;
        continue;
      }
      try {
        final UpsertResult result =
            stateStore.upsertIfAbsent(draftFactory.draft(sourceFeed, record), ORIGIN);
        if (result.created()) {
          tally.created++;
          logger.info(
              "notification recovered feed={} transactionId={} createdAt={}",
              sourceFeed.wireName(),
              record.id(),
              record.createdAt());
        } else {
          tally.lostRace++;
        }
      } catch (DataAccessException | NotificationEventPermanentException ex) {
        tally.failed++;
        logger.warn(
            "notification recovery failed feed={} transactionId={}",
            sourceFeed.wireName(),
            record.id(),
            ex);
      }
    }
  }

  private static final class Tally {
    private int scanned;
    private int alreadyNotified;
    private int suppressedByAudit;
    private int outsideWindow;
    private int created;
    private int lostRace;
    private int failed;
  }
}
