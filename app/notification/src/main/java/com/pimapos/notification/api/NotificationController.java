/*
 * Where: Notification API
 * What: Dashboard endpoints for the pending queue, operator actions, stats and housekeeping
 * Why: The dashboard reads and changes notification state only through this service
 */
package com.pimapos.notification.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pimapos.notification.config.NotificationApiProperties;
import com.pimapos.notification.model.HousekeepingSummary;
import com.pimapos.notification.model.LifecycleResult;
import com.pimapos.notification.model.NotificationAuditRecord;
import com.pimapos.notification.model.NotificationKey;
import com.pimapos.notification.model.NotificationState;
import com.pimapos.notification.model.NotificationStats;
import com.pimapos.notification.model.SourceFeed;
import com.pimapos.notification.service.HousekeepingInProgressException;
import com.pimapos.notification.service.HousekeepingService;
import com.pimapos.notification.service.NotificationAuditLog;
import com.pimapos.notification.service.NotificationLifecycleService;
import com.pimapos.notification.service.NotificationStateStore;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/notifications")
@RequiredArgsConstructor
public class NotificationController {

  private final NotificationStateStore stateStore;
  private final NotificationLifecycleService lifecycleService;
  private final NotificationAuditLog auditLog;
  private final HousekeepingService housekeepingService;
  private final NotificationApiProperties apiProperties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @GetMapping("/pending")
  public NotificationListResponse pending() {
    return toListResponse(stateStore.listPending());
  }

  /** Pending notifications created in the last {@code hours}; the emergency recovery view. */
  @GetMapping("/recent")
  public NotificationListResponse recent(
      @RequestParam(name = "hours", required = false) Integer hours) {
    final Duration window = resolveWindow(hours);
    return toListResponse(stateStore.listPendingCreatedSince(Instant.now(clock).minus(window)));
  }

  @PostMapping("/{feed}/{transactionId}/handle")
  public NotificationActionResponse handle(
      @PathVariable("feed") String feed,
      @PathVariable("transactionId") String transactionId,
      @Valid @RequestBody NotificationActionRequest request) {
    final LifecycleResult result =
        lifecycleService.handle(toKey(feed, transactionId), request.actor());
    return new NotificationActionResponse(result.transitioned(), toView(result.state()));
  }

  @PostMapping("/{feed}/{transactionId}/dismiss")
  public NotificationActionResponse dismiss(
      @PathVariable("feed") String feed,
      @PathVariable("transactionId") String transactionId,
      @Valid @RequestBody NotificationActionRequest request) {
    final LifecycleResult result =
        lifecycleService.dismiss(toKey(feed, transactionId), request.actor());
    return new NotificationActionResponse(result.transitioned(), toView(result.state()));
  }

  /** Audit history survives purge, so this works for keys that no longer have a state row. */
  @GetMapping("/{feed}/{transactionId}/audit")
  public List<AuditEntryView> audit(
      @PathVariable("feed") String feed, @PathVariable("transactionId") String transactionId) {
    return auditLog.history(toKey(feed, transactionId)).stream().map(this::toAuditView).toList();
  }

  @GetMapping("/stats")
  public NotificationStats stats() {
    return stateStore.stats();
  }

  @PostMapping("/housekeeping/run")
  public HousekeepingSummary runHousekeeping() {
    return housekeepingService.runTickIfIdle().orElseThrow(HousekeepingInProgressException::new);
  }

  private Duration resolveWindow(Integer hours) {
    if (hours == null) {
      return apiProperties.recentDefaultWindow();
    }
    if (hours <= 0) {
      throw new IllegalArgumentException("hours must be positive");
    }
    return Duration.ofHours(hours);
  }

  private NotificationKey toKey(String feed, String transactionId) {
    return NotificationKey.insert(SourceFeed.fromWireName(feed), transactionId);
  }

  private NotificationListResponse toListResponse(List<NotificationState> states) {
    final List<NotificationView> items = states.stream().map(this::toView).toList();
    return new NotificationListResponse(items.size(), items);
  }

  private NotificationView toView(NotificationState state) {
    return new NotificationView(
        state.id(),
        state.sourceFeed().wireName(),
        state.transactionTable(),
        state.transactionId(),
        state.eventType(),
        state.status(),
        state.priorityLevel(),
        state.requiresAction(),
        state.createdAt(),
        state.expiresAt(),
        state.handledAt(),
        state.handledBy(),
        state.version(),
        readJson(state.payloadJson()));
  }

  private AuditEntryView toAuditView(NotificationAuditRecord record) {
    return new AuditEntryView(
        record.auditId(),
        record.action(),
        record.actor(),
        record.occurredAt(),
        readJson(record.stateJson()));
  }

  private JsonNode readJson(String json) {
    if (json == null) {
      return null;
    }
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("stored notification json is not readable", ex);
    }
  }
}
