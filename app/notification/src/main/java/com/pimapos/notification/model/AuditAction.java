/*
 * Where: Notification domain model
 * What: Lifecycle transitions recorded in notification_audit_log
 * Why: The audit log is the permanent record used to suppress re-creation
 */
package com.pimapos.notification.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public enum AuditAction {
  CREATED,
  HANDLED,
  DISMISSED,
  EXPIRED,
  PURGED;

  private static final Set<AuditAction> SUPPRESSING =
      Collections.unmodifiableSet(EnumSet.of(HANDLED, DISMISSED, EXPIRED));

  /** Actions that permanently block a key from being recreated. Expiry is a dismissal. */
  public static Set<AuditAction> suppressing() {
    return SUPPRESSING;
  }
}
