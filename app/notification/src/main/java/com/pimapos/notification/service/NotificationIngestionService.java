/*
 * Where: Notification service layer
 * What: Creates notifications for live insert events
 * Why: Live delivery is at-least-once, so creation must be idempotent and never revive handled keys
 */
package com.pimapos.notification.service;

import com.pimapos.common.event.TransactionInsertedEvent;
import com.pimapos.notification.feed.TransactionRecord;
import com.pimapos.notification.model.IngestionOutcome;
import com.pimapos.notification.model.NotificationKey;
import com.pimapos.notification.model.SourceFeed;
import com.pimapos.notification.model.UpsertResult;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationIngestionService {

  static final String ORIGIN = "live-ingestion";

  private static final Logger logger = LoggerFactory.getLogger(NotificationIngestionService.class);

  private final NotificationStateStore stateStore;
  private final NotificationAuditLog auditLog;
  private final NotificationDraftFactory draftFactory;
  private final NotificationMetrics metrics;

  /**
   * Store failures are reported as {@link IngestionOutcome#FAILED} rather than thrown; the next
   * reconciliation picks the row up if it is still inside the recovery window.
   */
  public IngestionOutcome onTransactionCreated(SourceFeed feed, TransactionRecord record) {
    final NotificationKey key = NotificationKey.insert(feed, record.id());
    IngestionOutcome outcome;
    try {
      if (auditLog.isSuppressed(key)) {
        logger.info("notification ingestion suppressed key={}", key);
        outcome = IngestionOutcome.SUPPRESSED;
      } else {
        final UpsertResult result =
            stateStore.upsertIfAbsent(draftFactory.draft(feed, record), ORIGIN);
        outcome = result.created() ? IngestionOutcome.CREATED : IngestionOutcome.DUPLICATE;
        logger.info("notification ingestion key={} outcome={}", key, outcome);
      }
    } catch (DataAccessException ex) {
      logger.warn("notification ingestion failed key={}", key, ex);
      outcome = IngestionOutcome.FAILED;
    }
    metrics.recordIngestion(outcome);
    return outcome;
  }

  /**
   * @throws NotificationEventPermanentException when the event cannot describe a feed row
   */
  public IngestionOutcome onTransactionInserted(TransactionInsertedEvent event) {
    final SourceFeed feed = parseFeed(event);
    final TransactionRecord record =
        toRecord(event.transactionId(), parseCreatedAt(event), event);
    return onTransactionCreated(feed, record);
  }

  private SourceFeed parseFeed(TransactionInsertedEvent event) {
    try {
      return SourceFeed.fromWireName(event.feed());
    } catch (IllegalArgumentException ex) {
      throw new NotificationEventPermanentException("invalid transaction event feed", ex);
    }
  }

  private Instant parseCreatedAt(TransactionInsertedEvent event) {
    try {
      return Instant.parse(event.createdAt());
    } catch (RuntimeException ex) {
      // redelivery cannot fix a malformed timestamp
      throw new NotificationEventPermanentException("invalid transaction event created_at", ex);
    }
  }

  private TransactionRecord toRecord(
      String transactionId, Instant createdAt, TransactionInsertedEvent event) {
    try {
      return new TransactionRecord(transactionId, createdAt, event.record());
    } catch (IllegalArgumentException ex) {
      throw new NotificationEventPermanentException("invalid transaction event transaction_id", ex);
    }
  }
}
