/*
 * Where: Lifecycle manager unit tests
 * What: Handle/dismiss monotonicity, not-found, retry and the expiry sweep
 * Why: Repeated clicks and concurrent operators must never reopen or double-audit a notification
 */
package com.pimapos.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.pimapos.notification.NotificationFixtures;
import com.pimapos.notification.config.NotificationLifecycleProperties;
import com.pimapos.notification.model.LifecycleResult;
import com.pimapos.notification.model.NotificationKey;
import com.pimapos.notification.model.NotificationState;
import com.pimapos.notification.model.NotificationStatus;
import com.pimapos.notification.model.SourceFeed;
import com.pimapos.notification.model.TerminalTransition;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;

@ExtendWith(MockitoExtension.class)
class NotificationLifecycleServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final NotificationKey KEY = NotificationKey.insert(SourceFeed.PURCHASE, "t-1");
  private static final String ACTOR = "cashier-7";

  @Mock private NotificationStateStore stateStore;

  private SimpleMeterRegistry registry;
  private NotificationLifecycleService service;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    service = newService(NotificationFixtures.lifecycleProperties());
  }

  @Test
  void handleTransitionsPendingNotification() {
    final NotificationState pending =
        NotificationFixtures.pending(SourceFeed.PURCHASE, "t-1", NOW.minusSeconds(60));
    final NotificationState handled =
        NotificationFixtures.terminal(pending, TerminalTransition.HANDLE, ACTOR, NOW);
    when(stateStore.transitionIfPending(KEY, TerminalTransition.HANDLE, ACTOR, NOW))
        .thenReturn(Optional.of(handled));

    final LifecycleResult result = service.handle(KEY, ACTOR);

    assertThat(result.transitioned()).isTrue();
    assertThat(result.state().status()).isEqualTo(NotificationStatus.HANDLED);
    assertThat(result.state().handledBy()).isEqualTo(ACTOR);
    assertThat(
            registry
                .get("notification.lifecycle.transitions")
                .tag("action", "handled")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void dismissOnHandledNotificationIsANoOpThatKeepsItHandled() {
    final NotificationState handled =
        NotificationFixtures.terminal(
            NotificationFixtures.pending(SourceFeed.PURCHASE, "t-1", NOW.minusSeconds(60)),
            TerminalTransition.HANDLE,
            "cashier-1",
            NOW.minusSeconds(10));
    when(stateStore.transitionIfPending(KEY, TerminalTransition.DISMISS, ACTOR, NOW))
        .thenReturn(Optional.empty());
    when(stateStore.get(KEY)).thenReturn(Optional.of(handled));

    final LifecycleResult result = service.dismiss(KEY, ACTOR);

    assertThat(result.transitioned()).isFalse();
    assertThat(result.state().handled()).isTrue();
    assertThat(result.state().dismissed()).isFalse();
    assertThat(result.state().handledBy()).isEqualTo("cashier-1");
  }

  @Test
  void handleUnknownKeyThrowsNotFound() {
    when(stateStore.transitionIfPending(KEY, TerminalTransition.HANDLE, ACTOR, NOW))
        .thenReturn(Optional.empty());
    when(stateStore.get(KEY)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.handle(KEY, ACTOR))
        .isInstanceOf(NotificationNotFoundException.class)
        .hasMessageContaining("PURCHASE/t-1/INSERT");
  }

  @Test
  void blankActorIsRejectedBeforeTouchingTheStore() {
    assertThatThrownBy(() -> service.handle(KEY, " "))
        .isInstanceOf(IllegalArgumentException.class);
    verify(stateStore, never()).transitionIfPending(any(), any(), any(), any());
  }

  @Test
  void transientStoreErrorIsRetriedUpToMaxAttempts() {
    final NotificationState pending =
        NotificationFixtures.pending(SourceFeed.PURCHASE, "t-1", NOW.minusSeconds(60));
    when(stateStore.transitionIfPending(KEY, TerminalTransition.HANDLE, ACTOR, NOW))
        .thenThrow(new QueryTimeoutException("slow"))
        .thenReturn(
            Optional.of(
                NotificationFixtures.terminal(pending, TerminalTransition.HANDLE, ACTOR, NOW)));

    final LifecycleResult result = service.handle(KEY, ACTOR);

    assertThat(result.transitioned()).isTrue();
    verify(stateStore, times(2)).transitionIfPending(KEY, TerminalTransition.HANDLE, ACTOR, NOW);
  }

  @Test
  void transientStoreErrorPropagatesAfterLastAttempt() {
    service = newService(new NotificationLifecycleProperties(Duration.ofHours(24), 200, 2, Duration.ZERO));
    when(stateStore.transitionIfPending(KEY, TerminalTransition.HANDLE, ACTOR, NOW))
        .thenThrow(new QueryTimeoutException("slow"));

    assertThatThrownBy(() -> service.handle(KEY, ACTOR))
        .isInstanceOf(QueryTimeoutException.class);
    verify(stateStore, times(2)).transitionIfPending(KEY, TerminalTransition.HANDLE, ACTOR, NOW);
  }

  @Test
  void expirySweepDismissesPastDeadlineRowsAsSystemAutoExpire() {
    final NotificationState first =
        NotificationFixtures.pending(SourceFeed.PURCHASE, "t-1", NOW.minus(Duration.ofHours(25)));
    final NotificationState second =
        NotificationFixtures.pending(SourceFeed.SALE, "s-1", NOW.minus(Duration.ofHours(30)));
    when(stateStore.findExpiredPending(NOW, 200)).thenReturn(List.of(first, second));
    when(stateStore.transitionIfPending(
            any(), eq(TerminalTransition.EXPIRE), eq(NotificationState.SYSTEM_AUTO_EXPIRE), eq(NOW)))
        .thenAnswer(
            invocation ->
                Optional.of(
                    NotificationFixtures.terminal(
                        invocation.getArgument(0, NotificationKey.class).equals(first.key())
                            ? first
                            : second,
                        TerminalTransition.EXPIRE,
                        NotificationState.SYSTEM_AUTO_EXPIRE,
                        NOW)));

    final int expired = service.expirePastDeadline();

    assertThat(expired).isEqualTo(2);
    verify(stateStore)
        .transitionIfPending(
            first.key(), TerminalTransition.EXPIRE, NotificationState.SYSTEM_AUTO_EXPIRE, NOW);
    verify(stateStore)
        .transitionIfPending(
            second.key(), TerminalTransition.EXPIRE, NotificationState.SYSTEM_AUTO_EXPIRE, NOW);
  }

  @Test
  void expirySweepContinuesPastARowThatFails() {
    final NotificationState first =
        NotificationFixtures.pending(SourceFeed.PURCHASE, "t-1", NOW.minus(Duration.ofHours(25)));
    final NotificationState second =
        NotificationFixtures.pending(SourceFeed.PURCHASE, "t-2", NOW.minus(Duration.ofHours(26)));
    when(stateStore.findExpiredPending(NOW, 200)).thenReturn(List.of(first, second));
    when(stateStore.transitionIfPending(
            eq(first.key()), eq(TerminalTransition.EXPIRE), any(), eq(NOW)))
        .thenThrow(new DataAccessResourceFailureException("lost connection"));
    when(stateStore.transitionIfPending(
            eq(second.key()), eq(TerminalTransition.EXPIRE), any(), eq(NOW)))
        .thenReturn(
            Optional.of(
                NotificationFixtures.terminal(
                    second,
                    TerminalTransition.EXPIRE,
                    NotificationState.SYSTEM_AUTO_EXPIRE,
                    NOW)));

    assertThat(service.expirePastDeadline()).isEqualTo(1);
  }

  @Test
  void expirySweepPagesThroughFullBatches() {
    service = newService(new NotificationLifecycleProperties(Duration.ofHours(24), 1, 3, Duration.ZERO));
    final NotificationState first =
        NotificationFixtures.pending(SourceFeed.PURCHASE, "t-1", NOW.minus(Duration.ofHours(25)));
    when(stateStore.findExpiredPending(NOW, 1)).thenReturn(List.of(first)).thenReturn(List.of());
    when(stateStore.transitionIfPending(
            eq(first.key()), eq(TerminalTransition.EXPIRE), any(), eq(NOW)))
        .thenReturn(
            Optional.of(
                NotificationFixtures.terminal(
                    first, TerminalTransition.EXPIRE, NotificationState.SYSTEM_AUTO_EXPIRE, NOW)));

    assertThat(service.expirePastDeadline()).isEqualTo(1);
    verify(stateStore, times(2)).findExpiredPending(NOW, 1);
    verify(stateStore, never()).findExpiredPending(any(), eq(200));
  }

  @Test
  void expirySweepWithNothingDueDoesNothing() {
    when(stateStore.findExpiredPending(NOW, 200)).thenReturn(List.of());

    assertThat(service.expirePastDeadline()).isZero();
    verify(stateStore, never()).transitionIfPending(any(), any(), any(), any());
    verify(stateStore, times(1)).findExpiredPending(any(), anyInt());
  }

  private NotificationLifecycleService newService(NotificationLifecycleProperties properties) {
    return new NotificationLifecycleService(
        stateStore,
        properties,
        new NotificationMetrics(registry),
        Clock.fixed(NOW, ZoneOffset.UTC));
  }
}
