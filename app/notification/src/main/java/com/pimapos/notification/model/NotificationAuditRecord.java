/*
 * Where: Notification domain model
 * What: One append-only notification_audit_log row
 * Why: Separates audit construction from the repository insert
 */
package com.pimapos.notification.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationAuditRecord(
    UUID auditId,
    SourceFeed sourceFeed,
    String transactionId,
    NotificationEventType eventType,
    AuditAction action,
    String actor,
    String stateJson,
    Instant occurredAt) {

  public NotificationKey key() {
    return new NotificationKey(sourceFeed, transactionId, eventType);
  }
}
