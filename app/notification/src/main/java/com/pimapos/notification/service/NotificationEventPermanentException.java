/*
 * Where: Notification service layer
 * What: An event that can never be processed no matter how often it is redelivered
 * Why: The subscriber terms such messages instead of nak-ing them
 */
package com.pimapos.notification.service;

public class NotificationEventPermanentException extends RuntimeException {

  public NotificationEventPermanentException(String message) {
    super(message);
  }

  public NotificationEventPermanentException(String message, Throwable cause) {
    super(message, cause);
  }
}
