/*
 * Where: Notification service layer
 * What: Transactional facade over notification_states that pairs every write with its audit entry
 * Why: A state change and its audit row commit together or not at all
 */
package com.pimapos.notification.service;

import com.pimapos.notification.model.AuditAction;
import com.pimapos.notification.model.NotificationEventType;
import com.pimapos.notification.model.NotificationKey;
import com.pimapos.notification.model.NotificationState;
import com.pimapos.notification.model.NotificationStats;
import com.pimapos.notification.model.SourceFeed;
import com.pimapos.notification.model.TerminalTransition;
import com.pimapos.notification.model.UpsertResult;
import com.pimapos.notification.repository.NotificationStateRepository;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class NotificationStateStore {

  private static final Logger logger = LoggerFactory.getLogger(NotificationStateStore.class);

  private final NotificationStateRepository stateRepository;
  private final NotificationAuditLog auditLog;

  /**
   * Creates the notification unless its key already exists.
   *
   * <p>A lost uniqueness race is not an error: the winner's row is returned with {@code
   * created=false}.
   */
  @Transactional
  public UpsertResult upsertIfAbsent(NotificationState draft, String origin) {
    final Optional<NotificationState> inserted = stateRepository.insertIfAbsent(draft);
    if (inserted.isPresent()) {
      final NotificationState state = inserted.get();
      auditLog.append(state, AuditAction.CREATED, origin, state.updatedAt());
      return new UpsertResult(true, state);
    }
    final NotificationState existing =
        stateRepository
            .findByKey(draft.key())
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "notification insert conflicted but no row found key=" + draft.key()));
    logger.debug("notification already exists key={} origin={}", draft.key(), origin);
    return new UpsertResult(false, existing);
  }

  @Transactional(readOnly = true)
  public Optional<NotificationState> get(NotificationKey key) {
    return stateRepository.findByKey(key);
  }

  @Transactional(readOnly = true)
  public List<NotificationState> listPending() {
    return stateRepository.findPending();
  }

  @Transactional(readOnly = true)
  public List<NotificationState> listPendingCreatedSince(Instant since) {
    return stateRepository.findPendingCreatedSince(since);
  }

  @Transactional(readOnly = true)
  public Set<String> existingTransactionIds(SourceFeed feed, Collection<String> transactionIds) {
    return stateRepository.findExistingTransactionIds(
        feed, NotificationEventType.INSERT, transactionIds);
  }

  @Transactional(readOnly = true)
  public List<NotificationState> findExpiredPending(Instant now, int limit) {
    return stateRepository.findExpiredPending(now, limit);
  }

  /**
   * Applies a terminal transition if the row is still pending and appends the matching audit
   * entry.
   *
   * @return the updated row, or empty when nothing changed
   */
  @Transactional
  public Optional<NotificationState> transitionIfPending(
      NotificationKey key, TerminalTransition transition, String actor, Instant at) {
    final Optional<NotificationState> updated =
        stateRepository.markTerminalIfPending(key, transition, actor, at);
    updated.ifPresent(state -> auditLog.append(state, transition.auditAction(), actor, at));
    return updated;
  }

  /** Deletes one batch of old terminal rows; each deletion is audited as PURGED. */
  @Transactional
  public List<NotificationState> purgeTerminalHandledBefore(
      Instant threshold, int limit, String actor, Instant now) {
    final List<NotificationState> deleted =
        stateRepository.deleteTerminalHandledBefore(threshold, limit);
    for (NotificationState state : deleted) {
      auditLog.append(state, AuditAction.PURGED, actor, now);
    }
    return deleted;
  }

  @Transactional(readOnly = true)
  public NotificationStats stats() {
    return stateRepository.countStats();
  }
}
