package com.pimapos.notification.service;

import com.pimapos.notification.model.NotificationKey;

/** No notification row exists for the key, either never created or already purged. */
public class NotificationNotFoundException extends RuntimeException {

  private final transient NotificationKey key;

  public NotificationNotFoundException(NotificationKey key) {
    super("notification not found key=" + key);
    this.key = key;
  }

  public NotificationKey key() {
    return key;
  }
}
