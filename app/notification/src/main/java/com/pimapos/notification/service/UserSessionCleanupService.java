/*
 * Where: Notification service layer
 * What: Removes inactive and stale dashboard sessions
 * Why: Dashboard tabs register sessions but never delete them
 */
package com.pimapos.notification.service;

import com.pimapos.notification.config.NotificationRetentionProperties;
import com.pimapos.notification.repository.UserSessionRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class UserSessionCleanupService {

  private static final Logger logger = LoggerFactory.getLogger(UserSessionCleanupService.class);

  private final UserSessionRepository sessionRepository;
  private final NotificationRetentionProperties properties;
  private final Clock clock;

  public int cleanup() {
    final Instant threshold = Instant.now(clock).minus(properties.sessionRetention());
    final int deleted = sessionRepository.deleteInactiveOrLastSeenBefore(threshold);
    logger.info("user session cleanup deleted={} threshold={}", deleted, threshold);
    return deleted;
  }
}
