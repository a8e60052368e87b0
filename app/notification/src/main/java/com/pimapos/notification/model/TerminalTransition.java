/*
 * Where: Notification domain model
 * What: The three ways a pending notification becomes terminal
 * Why: Keeps the flag to set and the audit action to append in one place
 */
package com.pimapos.notification.model;

public enum TerminalTransition {
  HANDLE(true, false, AuditAction.HANDLED),
  DISMISS(false, true, AuditAction.DISMISSED),
  EXPIRE(false, true, AuditAction.EXPIRED);

  private final boolean handled;
  private final boolean dismissed;
  private final AuditAction auditAction;

  TerminalTransition(boolean handled, boolean dismissed, AuditAction auditAction) {
    this.handled = handled;
    this.dismissed = dismissed;
    this.auditAction = auditAction;
  }

  public boolean handled() {
    return handled;
  }

  public boolean dismissed() {
    return dismissed;
  }

  public AuditAction auditAction() {
    return auditAction;
  }

  /** Expiry only applies to rows whose deadline has passed. */
  public boolean requiresPastDeadline() {
    return this == EXPIRE;
  }
}
