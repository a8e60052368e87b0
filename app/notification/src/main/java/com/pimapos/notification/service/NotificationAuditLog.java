/*
 * Where: Notification service layer
 * What: Appends lifecycle transitions to the audit log and answers suppression queries
 * Why: A key that was ever handled, dismissed or expired must never be recreated, even after purge
 */
package com.pimapos.notification.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.pimapos.notification.model.AuditAction;
import com.pimapos.notification.model.NotificationAuditRecord;
import com.pimapos.notification.model.NotificationEventType;
import com.pimapos.notification.model.NotificationKey;
import com.pimapos.notification.model.NotificationState;
import com.pimapos.notification.model.NotificationStatus;
import com.pimapos.notification.model.SourceFeed;
import com.pimapos.notification.repository.NotificationAuditRepository;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationAuditLog {

  private final NotificationAuditRepository auditRepository;
  private final ObjectMapper objectMapper;

  /** Must run inside the transaction that wrote {@code state}. */
  public NotificationAuditRecord append(
      NotificationState state, AuditAction action, String actor, Instant at) {
    final NotificationAuditRecord record =
        new NotificationAuditRecord(
            UUID.randomUUID(),
            state.sourceFeed(),
            state.transactionId(),
            state.eventType(),
            action,
            actor,
            serializeSnapshot(state),
            at);
    auditRepository.insert(record);
    return record;
  }

  /** Transaction ids of {@code feed} that may never get a new notification. */
  public Set<String> suppressedTransactionIds(SourceFeed feed, Collection<String> transactionIds) {
    return auditRepository.findTransactionIdsWithAction(
        feed, NotificationEventType.INSERT, transactionIds, AuditAction.suppressing());
  }

  public boolean isSuppressed(NotificationKey key) {
    return auditRepository.existsWithAction(key, AuditAction.suppressing());
  }

  public List<NotificationAuditRecord> history(NotificationKey key) {
    return auditRepository.findByKey(key);
  }

  private String serializeSnapshot(NotificationState state) {
    try {
      return objectMapper.writeValueAsString(StateSnapshot.from(state));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("audit snapshot serialization failure", ex);
    }
  }

  // The feed payload stays out of the audit log; it can be large and is already in the feed.
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record StateSnapshot(
      UUID id,
      String transactionTable,
      NotificationStatus status,
      boolean handled,
      boolean dismissed,
      Instant createdAt,
      Instant expiresAt,
      Instant handledAt,
      String handledBy,
      long version) {

    static StateSnapshot from(NotificationState state) {
      return new StateSnapshot(
          state.id(),
          state.transactionTable(),
          state.status(),
          state.handled(),
          state.dismissed(),
          state.createdAt(),
          state.expiresAt(),
          state.handledAt(),
          state.handledBy(),
          state.version());
    }
  }
}
