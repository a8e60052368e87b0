/*
 * Where: Transaction feed contract
 * What: One purchase or sale row as seen by the notification engine
 * Why: Reconciliation and live ingestion build notifications from the same shape
 */
package com.pimapos.notification.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.pimapos.notification.model.NotificationKey;
import java.time.Instant;
import java.util.Objects;

public record TransactionRecord(String id, Instant createdAt, JsonNode payload) {

  public TransactionRecord {
    id = NotificationKey.normalizeTransactionId(id);
    Objects.requireNonNull(createdAt, "createdAt");
  }
}
