/*
 * Where: Transaction feed contract
 * What: Signals that one feed could not be read
 * Why: Reconciliation skips that feed for the tick and still processes the other one
 */
package com.pimapos.notification.feed;

import com.pimapos.notification.model.SourceFeed;

public class FeedUnavailableException extends RuntimeException {

  private final SourceFeed sourceFeed;

  public FeedUnavailableException(SourceFeed sourceFeed, String message, Throwable cause) {
    super(message, cause);
    this.sourceFeed = sourceFeed;
  }

  public SourceFeed sourceFeed() {
    return sourceFeed;
  }
}
