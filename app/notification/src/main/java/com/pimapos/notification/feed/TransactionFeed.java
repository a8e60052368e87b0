/*
 * Where: Transaction feed contract
 * What: Read-only access to one feed's recently created rows
 * Why: Reconciliation must only ever ask a feed for a bounded window
 */
package com.pimapos.notification.feed;

import com.pimapos.notification.model.SourceFeed;
import java.time.Instant;
import java.util.List;

public interface TransactionFeed {

  SourceFeed sourceFeed();

  /**
   * Returns rows with {@code created_at >= since}, oldest first.
   *
   * @throws FeedUnavailableException when the feed cannot be read
   */
  List<TransactionRecord> listCreatedSince(Instant since);
}
