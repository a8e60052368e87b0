/*
 * Where: Notification end-to-end tests
 * What: Drives ingestion, actions and housekeeping ticks against a real database
 * Why: Handled, dismissed and expired notifications must never come back, even after purge
 */
package com.pimapos.notification;

import static com.pimapos.common.JdbcTimestampUtils.toTimestamp;
import static org.assertj.core.api.Assertions.assertThat;

import com.pimapos.common.event.TransactionInsertedEvent;
import com.pimapos.notification.feed.TransactionRecord;
import com.pimapos.notification.model.AuditAction;
import com.pimapos.notification.model.HousekeepingSummary;
import com.pimapos.notification.model.IngestionOutcome;
import com.pimapos.notification.model.LifecycleResult;
import com.pimapos.notification.model.NotificationAuditRecord;
import com.pimapos.notification.model.NotificationKey;
import com.pimapos.notification.model.NotificationState;
import com.pimapos.notification.model.NotificationStatus;
import com.pimapos.notification.model.SourceFeed;
import com.pimapos.notification.service.HousekeepingService;
import com.pimapos.notification.service.NotificationAuditLog;
import com.pimapos.notification.service.NotificationIngestionService;
import com.pimapos.notification.service.NotificationLifecycleService;
import com.pimapos.notification.service.NotificationStateStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationLifecycleScenarioTest extends AbstractPostgresContainerTest {

  private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");
  private static final int THREADS = 8;

  @TestConfiguration
  static class ClockConfig {
    @Bean
    @Primary
    MutableClock testClock() {
      return new MutableClock(T0);
    }
  }

  @Autowired private MutableClock clock;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;
  @Autowired private NotificationIngestionService ingestionService;
  @Autowired private NotificationLifecycleService lifecycleService;
  @Autowired private HousekeepingService housekeepingService;
  @Autowired private NotificationStateStore stateStore;
  @Autowired private NotificationAuditLog auditLog;

  @BeforeEach
  void cleanup() {
    truncateAll(jdbcTemplate);
    clock.set(T0);
  }

  @Test
  void injectedClockIsTheTestClock(@Autowired Clock injected) {
    assertThat(injected.instant()).isEqualTo(T0);
  }

  @Test
  void handledNotificationIsNotRecreatedAfterPurge() {
    final TransactionRecord record = insertFeedRow("transactions", T0.minus(Duration.ofMinutes(10)));
    final NotificationKey key = NotificationKey.insert(SourceFeed.PURCHASE, record.id());

    assertThat(ingestionService.onTransactionCreated(SourceFeed.PURCHASE, record))
        .isEqualTo(IngestionOutcome.CREATED);
    assertThat(lifecycleService.handle(key, "cashier-7").transitioned()).isTrue();

    clock.advance(Duration.ofMinutes(61));
    final HousekeepingSummary first = tick();
    assertThat(first.purged()).isEqualTo(1);
    assertThat(first.reconciliation().suppressedByAudit()).isEqualTo(1);
    assertThat(stateStore.get(key)).isEmpty();

    clock.advance(Duration.ofMinutes(5));
    final HousekeepingSummary second = tick();
    assertThat(second.reconciliation().suppressedByAudit()).isEqualTo(1);
    assertThat(second.reconciliation().created()).isZero();
    assertThat(stateStore.get(key)).isEmpty();

    assertThat(ingestionService.onTransactionCreated(SourceFeed.PURCHASE, record))
        .isEqualTo(IngestionOutcome.SUPPRESSED);
    assertThat(auditLog.history(key))
        .extracting(NotificationAuditRecord::action)
        .containsExactly(AuditAction.CREATED, AuditAction.HANDLED, AuditAction.PURGED);
  }

  @Test
  void reconciliationRecoversMissedRowWithItsOwnCreationTime() {
    final Instant createdAt = T0.minus(Duration.ofMinutes(30));
    final TransactionRecord record = insertFeedRow("sales_transactions", createdAt);
    insertFeedRow("sales_transactions", T0.minus(Duration.ofHours(3)));

    final HousekeepingSummary summary = tick();

    assertThat(summary.reconciliation().created()).isEqualTo(1);
    assertThat(summary.failedStages()).isEmpty();
    final NotificationState state =
        stateStore.get(NotificationKey.insert(SourceFeed.SALE, record.id())).orElseThrow();
    assertThat(state.createdAt()).isEqualTo(createdAt);
    assertThat(state.expiresAt()).isEqualTo(createdAt.plus(Duration.ofHours(24)));
    assertThat(state.status()).isEqualTo(NotificationStatus.PENDING);
    assertThat(stateStore.listPending()).hasSize(1);

    assertThat(tick().reconciliation().alreadyNotified()).isEqualTo(1);
  }

  @Test
  void pendingNotificationExpiresAndIsPurgedLater() {
    final TransactionRecord record = insertFeedRow("transactions", T0.minus(Duration.ofHours(1)));
    final NotificationKey key = NotificationKey.insert(SourceFeed.PURCHASE, record.id());
    ingestionService.onTransactionCreated(SourceFeed.PURCHASE, record);

    clock.advance(Duration.ofHours(24));
    final HousekeepingSummary expiring = tick();
    assertThat(expiring.expired()).isEqualTo(1);
    assertThat(expiring.purged()).isZero();
    final NotificationState expired = stateStore.get(key).orElseThrow();
    assertThat(expired.status()).isEqualTo(NotificationStatus.EXPIRED);
    assertThat(expired.handledBy()).isEqualTo(NotificationState.SYSTEM_AUTO_EXPIRE);

    assertThat(lifecycleService.handle(key, "cashier-7").transitioned()).isFalse();

    clock.advance(Duration.ofHours(2));
    assertThat(tick().purged()).isEqualTo(1);
    assertThat(auditLog.history(key))
        .extracting(NotificationAuditRecord::action)
        .containsExactly(AuditAction.CREATED, AuditAction.EXPIRED, AuditAction.PURGED);
  }

  @Test
  void liveEventAndFeedRowWithDifferentIdSpellingShareOneNotification() {
    final Instant createdAt = T0.minus(Duration.ofMinutes(5));
    final TransactionRecord record = insertFeedRow("transactions", createdAt);
    final TransactionInsertedEvent event =
        new TransactionInsertedEvent(
            "purchase",
            record.id().toUpperCase(Locale.ROOT),
            createdAt.toString(),
            record.payload(),
            null);

    assertThat(ingestionService.onTransactionInserted(event)).isEqualTo(IngestionOutcome.CREATED);
    final HousekeepingSummary summary = tick();

    assertThat(summary.reconciliation().alreadyNotified()).isEqualTo(1);
    assertThat(summary.reconciliation().created()).isZero();
    assertThat(stateStore.listPending())
        .extracting(NotificationState::transactionId)
        .containsExactly(record.id());
  }

  @Test
  void concurrentIngestionCreatesExactlyOnce() throws Exception {
    final TransactionRecord record = insertFeedRow("transactions", T0.minusSeconds(30));

    final List<IngestionOutcome> outcomes =
        runConcurrently(() -> ingestionService.onTransactionCreated(SourceFeed.PURCHASE, record));

    assertThat(outcomes).filteredOn(o -> o == IngestionOutcome.CREATED).hasSize(1);
    assertThat(outcomes).filteredOn(o -> o == IngestionOutcome.DUPLICATE).hasSize(THREADS - 1);
    assertThat(auditLog.history(NotificationKey.insert(SourceFeed.PURCHASE, record.id())))
        .extracting(NotificationAuditRecord::action)
        .containsExactly(AuditAction.CREATED);
  }

  @Test
  void concurrentHandleAndDismissTransitionExactlyOnce() throws Exception {
    final TransactionRecord record = insertFeedRow("sales_transactions", T0.minusSeconds(30));
    final NotificationKey key = NotificationKey.insert(SourceFeed.SALE, record.id());
    ingestionService.onTransactionCreated(SourceFeed.SALE, record);

    final List<Callable<LifecycleResult>> calls = new ArrayList<>();
    for (int i = 0; i < THREADS; i++) {
      final String actor = "cashier-" + i;
      calls.add(
          i % 2 == 0
              ? () -> lifecycleService.handle(key, actor)
              : () -> lifecycleService.dismiss(key, actor));
    }
    final List<LifecycleResult> results = runConcurrently(calls);

    assertThat(results).filteredOn(LifecycleResult::transitioned).hasSize(1);
    assertThat(stateStore.get(key).orElseThrow().version()).isEqualTo(1);
    assertThat(auditLog.history(key))
        .extracting(NotificationAuditRecord::action)
        .filteredOn(
            action -> EnumSet.of(AuditAction.HANDLED, AuditAction.DISMISSED).contains(action))
        .hasSize(1);
  }

  private HousekeepingSummary tick() {
    return housekeepingService.runTickIfIdle().orElseThrow();
  }

  private TransactionRecord insertFeedRow(String table, Instant createdAt) {
    final UUID id = UUID.randomUUID();
    jdbcTemplate.update(
        "INSERT INTO " + table + " (id, total_amount, created_at) VALUES (:id, 42.00, :createdAt)",
        new MapSqlParameterSource().addValue("id", id).addValue("createdAt", toTimestamp(createdAt)));
    return NotificationFixtures.record(id.toString(), createdAt);
  }

  private <T> List<T> runConcurrently(Callable<T> call) throws Exception {
    final List<Callable<T>> calls = new ArrayList<>();
    for (int i = 0; i < THREADS; i++) {
      calls.add(call);
    }
    return runConcurrently(calls);
  }

  private <T> List<T> runConcurrently(List<Callable<T>> calls) throws Exception {
    final ExecutorService executor = Executors.newFixedThreadPool(calls.size());
    final CountDownLatch start = new CountDownLatch(1);
    try {
      final List<Future<T>> futures = new ArrayList<>();
      for (Callable<T> call : calls) {
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  return call.call();
                }));
      }
      start.countDown();
      final List<T> results = new ArrayList<>();
      for (Future<T> future : futures) {
        results.add(future.get(30, TimeUnit.SECONDS));
      }
      return results;
    } finally {
      executor.shutdownNow();
    }
  }
}
