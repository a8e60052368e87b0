/*
 * Where: Notification domain model
 * What: Display priority stored with each notification
 * Why: The dashboard orders and colours the pending queue by it
 */
package com.pimapos.notification.model;

public enum PriorityLevel {
  HIGH,
  MEDIUM,
  LOW
}
