/*
 * Where: Notification domain model
 * What: Result of processing one live insert event
 * Why: The NATS subscriber decides ack/nak from it and metrics are tagged by it
 */
package com.pimapos.notification.model;

public enum IngestionOutcome {
  CREATED,
  DUPLICATE,
  SUPPRESSED,
  FAILED
}
