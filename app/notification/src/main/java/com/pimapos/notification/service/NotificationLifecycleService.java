/*
 * Where: Notification service layer
 * What: Handle, dismiss and auto-expire pending notifications
 * Why: Terminal transitions are one-way; the conditional update makes them safe without locks
 */
package com.pimapos.notification.service;

import com.pimapos.notification.config.NotificationLifecycleProperties;
import com.pimapos.notification.model.LifecycleResult;
import com.pimapos.notification.model.NotificationKey;
import com.pimapos.notification.model.NotificationState;
import com.pimapos.notification.model.TerminalTransition;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationLifecycleService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationLifecycleService.class);

  private final NotificationStateStore stateStore;
  private final NotificationLifecycleProperties properties;
  private final NotificationMetrics metrics;
  private final Clock clock;

  public LifecycleResult handle(NotificationKey key, String actor) {
    return transition(key, TerminalTransition.HANDLE, actor);
  }

  public LifecycleResult dismiss(NotificationKey key, String actor) {
    return transition(key, TerminalTransition.DISMISS, actor);
  }

  /**
   * Auto-dismisses every pending notification whose deadline has passed.
   *
   * @return number of notifications expired by this sweep
   */
  public int expirePastDeadline() {
    final int batchSize = properties.expiryBatchSize();
    int expired = 0;
    while (true) {
      final Instant now = Instant.now(clock);
      final List<NotificationState> batch = stateStore.findExpiredPending(now, batchSize);
      int progressed = 0;
      for (NotificationState state : batch) {
        try {
          final Optional<NotificationState> updated =
              withRetry(
                  "expire",
                  state.key(),
                  () ->
                      stateStore.transitionIfPending(
                          state.key(),
                          TerminalTransition.EXPIRE,
                          NotificationState.SYSTEM_AUTO_EXPIRE,
                          now));
          if (updated.isPresent()) {
            progressed++;
          }
        } catch (DataAccessException ex) {
          logger.warn("notification expiry failed key={}", state.key(), ex);
        }
      }
      expired += progressed;
      if (batch.size() < batchSize || progressed == 0) {
        break;
      }
    }
    metrics.recordTransitions(TerminalTransition.EXPIRE.auditAction(), expired);
    if (expired > 0) {
      logger.info("notification expiry sweep expired={}", expired);
    }
    return expired;
  }

  private LifecycleResult transition(
      NotificationKey key, TerminalTransition transition, String actor) {
    if (actor == null || actor.isBlank()) {
      throw new IllegalArgumentException("actor is required");
    }
    final Instant now = Instant.now(clock);
    final Optional<NotificationState> updated =
        withRetry(
            transition.name().toLowerCase(Locale.ROOT),
            key,
            () -> stateStore.transitionIfPending(key, transition, actor, now));
    if (updated.isPresent()) {
      metrics.recordTransition(transition.auditAction());
      logger.info(
          "notification transitioned key={} action={} actor={}",
          key,
          transition.auditAction(),
          actor);
      return new LifecycleResult(updated.get(), true);
    }
    final NotificationState current =
        stateStore.get(key).orElseThrow(() -> new NotificationNotFoundException(key));
    // Already terminal: repeat clicks and concurrent operators end up here.
    logger.info(
        "notification transition ignored key={} action={} actor={} status={} handledBy={}",
        key,
        transition.auditAction(),
        actor,
        current.status(),
        current.handledBy());
    return new LifecycleResult(current, false);
  }

  private <T> T withRetry(String operation, NotificationKey key, Supplier<T> action) {
    final int maxAttempts = properties.maxAttempts();
    int attempt = 1;
    while (true) {
      try {
        return action.get();
      } catch (TransientDataAccessException | RecoverableDataAccessException ex) {
        if (attempt >= maxAttempts) {
          throw ex;
        }
        logger.warn(
            "notification {} retrying key={} attempt={} maxAttempts={}",
            operation,
            key,
            attempt,
            maxAttempts,
            ex);
        backoff(ex);
        attempt++;
      }
    }
  }

  private void backoff(DataAccessException cause) {
    final Duration delay = properties.retryBackoff();
    if (delay.isZero()) {
      return;
    }
    try {
      Thread.sleep(delay.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw cause;
    }
  }
}
