/*
 * Where: Notification service layer
 * What: Deletes terminal notifications once their retention has passed
 * Why: The state table only needs live rows; the audit log keeps the permanent record
 */
package com.pimapos.notification.service;

import com.pimapos.notification.config.NotificationRetentionProperties;
import com.pimapos.notification.model.AuditAction;
import com.pimapos.notification.model.NotificationState;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationPurgeService {

  static final String ACTOR = "system-purge";

  private static final Logger logger = LoggerFactory.getLogger(NotificationPurgeService.class);

  private final NotificationStateStore stateStore;
  private final NotificationRetentionProperties properties;
  private final NotificationMetrics metrics;
  private final Clock clock;

  /** Pending rows are never purged, however old. */
  public int purge() {
    final Instant now = Instant.now(clock);
    final Instant threshold = now.minus(properties.handledRetention());
    final int batchSize = properties.purgeBatchSize();
    int purged = 0;
    List<NotificationState> batch;
    do {
      batch = stateStore.purgeTerminalHandledBefore(threshold, batchSize, ACTOR, now);
      purged += batch.size();
    } while (batch.size() == batchSize);
    metrics.recordTransitions(AuditAction.PURGED, purged);
    logger.info("notification purge deleted={} threshold={}", purged, threshold);
    return purged;
  }
}
