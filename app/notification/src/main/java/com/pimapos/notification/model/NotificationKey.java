/*
 * Where: Notification domain model
 * What: Dedup key (source feed, transaction id, event type)
 * Why: Every store, audit and lifecycle lookup is addressed by this tuple
 */
package com.pimapos.notification.model;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

public record NotificationKey(
    SourceFeed sourceFeed, String transactionId, NotificationEventType eventType) {

  private static final Pattern UUID_TEXT =
      Pattern.compile(
          "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

  public NotificationKey {
    Objects.requireNonNull(sourceFeed, "sourceFeed");
    Objects.requireNonNull(eventType, "eventType");
    transactionId = normalizeTransactionId(transactionId);
  }

  /**
   * Returns the spelling every writer keys on: trimmed, and UUIDs in PostgreSQL's lowercase text
   * form, so {@code "3F2504E0-..."} from an event and {@code "3f2504e0-..."} from a feed row match.
   *
   * @throws IllegalArgumentException when the id is null or blank
   */
  public static String normalizeTransactionId(String transactionId) {
    if (transactionId == null || transactionId.isBlank()) {
      throw new IllegalArgumentException("transaction id is required");
    }
    final String trimmed = transactionId.trim();
    if (UUID_TEXT.matcher(trimmed).matches()) {
      return trimmed.toLowerCase(Locale.ROOT);
    }
    return trimmed;
  }

  public static NotificationKey insert(SourceFeed sourceFeed, String transactionId) {
    return new NotificationKey(sourceFeed, transactionId, NotificationEventType.INSERT);
  }

  @Override
  public String toString() {
    return sourceFeed.name() + "/" + transactionId + "/" + eventType.name();
  }
}
