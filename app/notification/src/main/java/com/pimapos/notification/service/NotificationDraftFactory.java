/*
 * Where: Notification service layer
 * What: Builds a pending NotificationState from a feed record
 * Why: Reconciliation and live ingestion must derive createdAt and expiresAt the same way
 */
package com.pimapos.notification.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pimapos.notification.config.NotificationFeedProperties;
import com.pimapos.notification.config.NotificationLifecycleProperties;
import com.pimapos.notification.feed.TransactionRecord;
import com.pimapos.notification.model.NotificationEventType;
import com.pimapos.notification.model.NotificationState;
import com.pimapos.notification.model.PriorityLevel;
import com.pimapos.notification.model.SourceFeed;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationDraftFactory {

  private final NotificationLifecycleProperties lifecycleProperties;
  private final NotificationFeedProperties feedProperties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /** createdAt is the transaction's own time; using the scan time would extend the deadline. */
  public NotificationState draft(SourceFeed feed, TransactionRecord record) {
    final Instant createdAt = record.createdAt();
    return new NotificationState(
        UUID.randomUUID(),
        feed,
        feedProperties.tableFor(feed),
        record.id(),
        NotificationEventType.INSERT,
        serializePayload(record),
        false,
        false,
        PriorityLevel.HIGH,
        true,
        createdAt,
        createdAt.plus(lifecycleProperties.ttl()),
        null,
        null,
        0L,
        Instant.now(clock));
  }

  private String serializePayload(TransactionRecord record) {
    if (record.payload() == null || record.payload().isNull()) {
      return "{}";
    }
    try {
      return objectMapper.writeValueAsString(record.payload());
    } catch (JsonProcessingException ex) {
      throw new NotificationEventPermanentException("transaction payload serialization failure", ex);
    }
  }
}
