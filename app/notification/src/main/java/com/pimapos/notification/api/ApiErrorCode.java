/*
 * Where: Notification API
 * What: Error codes returned in ApiErrorResponse
 * Why: Lets the dashboard tell "already purged" apart from "bad input" and "try again"
 */
package com.pimapos.notification.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  NOTIFICATION_NOT_FOUND,
  HOUSEKEEPING_IN_PROGRESS,
  STORE_UNAVAILABLE
}
