/*
 * Where: Notification domain model
 * What: Snapshot of one notification_states row
 * Why: Shared by the store, lifecycle manager, reconciliation and API
 */
package com.pimapos.notification.model;

import java.time.Instant;
import java.util.UUID;

/**
 * One pending-action row per dedup key.
 *
 * <p>{@code createdAt} is the originating transaction's creation time, not the time the row was
 * written, and {@code expiresAt} is derived from it. Once {@code handled} or {@code dismissed} is
 * true neither flag goes back to false.
 */
public record NotificationState(
    UUID id,
    SourceFeed sourceFeed,
    String transactionTable,
    String transactionId,
    NotificationEventType eventType,
    String payloadJson,
    boolean handled,
    boolean dismissed,
    PriorityLevel priorityLevel,
    boolean requiresAction,
    Instant createdAt,
    Instant expiresAt,
    Instant handledAt,
    String handledBy,
    long version,
    Instant updatedAt) {

  public static final String SYSTEM_AUTO_EXPIRE = "system-auto-expire";

  public NotificationKey key() {
    return new NotificationKey(sourceFeed, transactionId, eventType);
  }

  public boolean isTerminal() {
    return handled || dismissed;
  }

  public NotificationStatus status() {
    if (dismissed) {
      return SYSTEM_AUTO_EXPIRE.equals(handledBy)
          ? NotificationStatus.EXPIRED
          : NotificationStatus.DISMISSED;
    }
    if (handled) {
      return NotificationStatus.HANDLED;
    }
    return NotificationStatus.PENDING;
  }
}
