/*
 * Where: Notification domain model
 * What: Kind of feed change a notification was raised for
 * Why: Part of the dedup key; only inserts raise notifications today
 */
package com.pimapos.notification.model;

public enum NotificationEventType {
  INSERT
}
