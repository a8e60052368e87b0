/*
 * Where: Notification domain model
 * What: The two transaction feeds a notification can originate from
 * Why: The feed is part of the dedup key and of the wire/path names
 */
package com.pimapos.notification.model;

import java.util.Locale;

public enum SourceFeed {
  PURCHASE("purchase"),
  SALE("sale");

  private final String wireName;

  SourceFeed(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /** Accepts either the wire name ({@code purchase}) or the enum name ({@code PURCHASE}). */
  public static SourceFeed fromWireName(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("feed is required");
    }
    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (SourceFeed feed : values()) {
      if (feed.wireName.equals(normalized)) {
        return feed;
      }
    }
    throw new IllegalArgumentException("unknown feed: " + value);
  }
}
