/*
 * Where: Notification data access
 * What: Appends to and queries notification_audit_log
 * Why: The audit log outlives the state rows and decides which keys may never be recreated
 */
package com.pimapos.notification.repository;

import static com.pimapos.common.JdbcTimestampUtils.toTimestamp;

import com.pimapos.notification.model.AuditAction;
import com.pimapos.notification.model.NotificationAuditRecord;
import com.pimapos.notification.model.NotificationEventType;
import com.pimapos.notification.model.NotificationKey;
import com.pimapos.notification.model.SourceFeed;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationAuditRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insert(NotificationAuditRecord record) {
    final String sql =
        """
        INSERT INTO notification_audit_log (
          audit_id,
          source_feed,
          transaction_id,
          event_type,
          action,
          actor,
          state_snapshot,
          occurred_at
        ) VALUES (
          :auditId,
          :sourceFeed,
          :transactionId,
          :eventType,
          :action,
          :actor,
          :stateSnapshot::jsonb,
          :occurredAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("auditId", record.auditId())
            .addValue("sourceFeed", record.sourceFeed().name())
            .addValue("transactionId", record.transactionId())
            .addValue("eventType", record.eventType().name())
            .addValue("action", record.action().name())
            .addValue("actor", record.actor())
            .addValue("stateSnapshot", record.stateJson())
            .addValue("occurredAt", toTimestamp(record.occurredAt()));
    return jdbcTemplate.update(sql, params);
  }

  /** Returns the subset of {@code transactionIds} that ever recorded one of {@code actions}. */
  public Set<String> findTransactionIdsWithAction(
      SourceFeed sourceFeed,
      NotificationEventType eventType,
      Collection<String> transactionIds,
      Collection<AuditAction> actions) {
    if (transactionIds.isEmpty() || actions.isEmpty()) {
      return Set.of();
    }
    final String sql =
        """
        SELECT DISTINCT transaction_id
        FROM notification_audit_log
        WHERE source_feed = :sourceFeed
          AND event_type = :eventType
          AND transaction_id IN (:transactionIds)
          AND action IN (:actions)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sourceFeed", sourceFeed.name())
            .addValue("eventType", eventType.name())
            .addValue("transactionIds", transactionIds)
            .addValue("actions", actions.stream().map(AuditAction::name).toList());
    return new HashSet<>(jdbcTemplate.queryForList(sql, params, String.class));
  }

  public boolean existsWithAction(NotificationKey key, Collection<AuditAction> actions) {
    if (actions.isEmpty()) {
      return false;
    }
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1
          FROM notification_audit_log
          WHERE source_feed = :sourceFeed
            AND transaction_id = :transactionId
            AND event_type = :eventType
            AND action IN (:actions)
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sourceFeed", key.sourceFeed().name())
            .addValue("transactionId", key.transactionId())
            .addValue("eventType", key.eventType().name())
            .addValue("actions", actions.stream().map(AuditAction::name).toList());
    final Boolean exists = jdbcTemplate.queryForObject(sql, params, Boolean.class);
    return Boolean.TRUE.equals(exists);
  }

  public List<NotificationAuditRecord> findByKey(NotificationKey key) {
    final String sql =
        """
        SELECT audit_id, source_feed, transaction_id, event_type, action, actor,
               state_snapshot::text AS state_snapshot_text, occurred_at
        FROM notification_audit_log
        WHERE source_feed = :sourceFeed
          AND transaction_id = :transactionId
          AND event_type = :eventType
        ORDER BY occurred_at, audit_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sourceFeed", key.sourceFeed().name())
            .addValue("transactionId", key.transactionId())
            .addValue("eventType", key.eventType().name());
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private NotificationAuditRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationAuditRecord(
        UUID.fromString(rs.getString("audit_id")),
        SourceFeed.valueOf(rs.getString("source_feed")),
        rs.getString("transaction_id"),
        NotificationEventType.valueOf(rs.getString("event_type")),
        AuditAction.valueOf(rs.getString("action")),
        rs.getString("actor"),
        rs.getString("state_snapshot_text"),
        rs.getTimestamp("occurred_at").toInstant());
  }
}
