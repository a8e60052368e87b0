/*
 * Where: Notification domain model
 * What: Lifecycle status derived from the handled/dismissed flags
 * Why: API responses and logs read better with one status than with two flags
 */
package com.pimapos.notification.model;

public enum NotificationStatus {
  PENDING,
  HANDLED,
  DISMISSED,
  EXPIRED
}
