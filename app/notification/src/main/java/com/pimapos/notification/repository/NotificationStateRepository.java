/*
 * Where: Notification data access
 * What: Insert-if-absent, lookup, conditional terminal update and purge for notification_states
 * Why: Uniqueness and monotonicity are enforced by single SQL statements, not in-process locks
 */
package com.pimapos.notification.repository;

import static com.pimapos.common.JdbcTimestampUtils.toInstant;
import static com.pimapos.common.JdbcTimestampUtils.toTimestamp;

import com.pimapos.notification.model.NotificationEventType;
import com.pimapos.notification.model.NotificationKey;
import com.pimapos.notification.model.NotificationState;
import com.pimapos.notification.model.NotificationStats;
import com.pimapos.notification.model.PriorityLevel;
import com.pimapos.notification.model.SourceFeed;
import com.pimapos.notification.model.TerminalTransition;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationStateRepository {

  private static final String COLUMNS =
      """
      id, source_feed, transaction_table, transaction_id, event_type,
      payload_snapshot::text AS payload_snapshot_text,
      is_handled, is_dismissed, priority_level, requires_action,
      created_at, expires_at, handled_at, handled_by, version, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Inserts the row unless its dedup key already exists.
   *
   * @return the inserted row, or empty when another writer got there first
   */
  public Optional<NotificationState> insertIfAbsent(NotificationState record) {
    final String sql =
        """
        INSERT INTO notification_states (
          id,
          source_feed,
          transaction_table,
          transaction_id,
          event_type,
          payload_snapshot,
          is_handled,
          is_dismissed,
          priority_level,
          requires_action,
          created_at,
          expires_at,
          handled_at,
          handled_by,
          version,
          updated_at
        ) VALUES (
          :id,
          :sourceFeed,
          :transactionTable,
          :transactionId,
          :eventType,
          :payloadSnapshot::jsonb,
          :handled,
          :dismissed,
          :priorityLevel,
          :requiresAction,
          :createdAt,
          :expiresAt,
          :handledAt,
          :handledBy,
          :version,
          :updatedAt
        )
        ON CONFLICT ON CONSTRAINT uq_notification_states_key DO NOTHING
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", record.id())
            .addValue("sourceFeed", record.sourceFeed().name())
            .addValue("transactionTable", record.transactionTable())
            .addValue("transactionId", record.transactionId())
            .addValue("eventType", record.eventType().name())
            .addValue("payloadSnapshot", record.payloadJson())
            .addValue("handled", record.handled())
            .addValue("dismissed", record.dismissed())
            .addValue("priorityLevel", record.priorityLevel().name())
            .addValue("requiresAction", record.requiresAction())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("expiresAt", toTimestamp(record.expiresAt()))
            .addValue("handledAt", toTimestamp(record.handledAt()))
            .addValue("handledBy", record.handledBy())
            .addValue("version", record.version())
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<NotificationState> findByKey(NotificationKey key) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM notification_states
            WHERE source_feed = :sourceFeed
              AND transaction_id = :transactionId
              AND event_type = :eventType
            """;
    return jdbcTemplate.query(sql, keyParams(key), this::mapRow).stream().findFirst();
  }

  /** Returns the subset of {@code transactionIds} that already have a row for the feed. */
  public Set<String> findExistingTransactionIds(
      SourceFeed sourceFeed, NotificationEventType eventType, Collection<String> transactionIds) {
    if (transactionIds.isEmpty()) {
      return Set.of();
    }
    final String sql =
        """
        SELECT transaction_id
        FROM notification_states
        WHERE source_feed = :sourceFeed
          AND event_type = :eventType
          AND transaction_id IN (:transactionIds)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sourceFeed", sourceFeed.name())
            .addValue("eventType", eventType.name())
            .addValue("transactionIds", transactionIds);
    return new HashSet<>(jdbcTemplate.queryForList(sql, params, String.class));
  }

  public List<NotificationState> findPending() {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM notification_states
            WHERE is_handled = FALSE
              AND is_dismissed = FALSE
            ORDER BY created_at
            """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public List<NotificationState> findPendingCreatedSince(Instant since) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM notification_states
            WHERE is_handled = FALSE
              AND is_dismissed = FALSE
              AND created_at >= :since
            ORDER BY created_at
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("since", toTimestamp(since));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<NotificationState> findExpiredPending(Instant now, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM notification_states
            WHERE is_handled = FALSE
              AND is_dismissed = FALSE
              AND expires_at < :now
            ORDER BY expires_at
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /**
   * Moves a pending row to a terminal state in one conditional statement.
   *
   * @return the updated row, or empty when the row is missing, already terminal, or (for expiry)
   *     not yet past its deadline
   */
  public Optional<NotificationState> markTerminalIfPending(
      NotificationKey key, TerminalTransition transition, String actor, Instant at) {
    // The WHERE clause is the compare-and-swap: a terminal row never matches again.
    final String sql =
        """
        UPDATE notification_states
        SET is_handled = :handled,
            is_dismissed = :dismissed,
            handled_at = :at,
            handled_by = :actor,
            version = version + 1,
            updated_at = :at
        WHERE source_feed = :sourceFeed
          AND transaction_id = :transactionId
          AND event_type = :eventType
          AND is_handled = FALSE
          AND is_dismissed = FALSE
        """
            + (transition.requiresPastDeadline() ? "  AND expires_at < :at\n" : "")
            + "RETURNING "
            + COLUMNS;
    final MapSqlParameterSource params =
        keyParams(key)
            .addValue("handled", transition.handled())
            .addValue("dismissed", transition.dismissed())
            .addValue("at", toTimestamp(at))
            .addValue("actor", actor);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** Deletes up to {@code limit} terminal rows whose handled_at is before the threshold. */
  public List<NotificationState> deleteTerminalHandledBefore(Instant threshold, int limit) {
    final String sql =
        """
        DELETE FROM notification_states
        WHERE id IN (
          SELECT id
          FROM notification_states
          WHERE (is_handled = TRUE OR is_dismissed = TRUE)
            AND handled_at < :threshold
          ORDER BY handled_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("threshold", toTimestamp(threshold))
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public NotificationStats countStats() {
    final String sql =
        """
        SELECT COUNT(*) AS total,
               COUNT(*) FILTER (WHERE is_handled = FALSE AND is_dismissed = FALSE) AS pending,
               COUNT(*) FILTER (WHERE is_handled = TRUE AND is_dismissed = FALSE) AS handled,
               COUNT(*) FILTER (WHERE is_dismissed = TRUE) AS dismissed,
               COUNT(*) FILTER (WHERE is_dismissed = TRUE AND handled_by = :autoExpire) AS expired
        FROM notification_states
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("autoExpire", NotificationState.SYSTEM_AUTO_EXPIRE);
    return jdbcTemplate.queryForObject(
        sql,
        params,
        (rs, rowNum) ->
            new NotificationStats(
                rs.getLong("total"),
                rs.getLong("pending"),
                rs.getLong("handled"),
                rs.getLong("dismissed"),
                rs.getLong("expired")));
  }

  private MapSqlParameterSource keyParams(NotificationKey key) {
    return new MapSqlParameterSource()
        .addValue("sourceFeed", key.sourceFeed().name())
        .addValue("transactionId", key.transactionId())
        .addValue("eventType", key.eventType().name());
  }

  private NotificationState mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationState(
        UUID.fromString(rs.getString("id")),
        SourceFeed.valueOf(rs.getString("source_feed")),
        rs.getString("transaction_table"),
        rs.getString("transaction_id"),
        NotificationEventType.valueOf(rs.getString("event_type")),
        rs.getString("payload_snapshot_text"),
        rs.getBoolean("is_handled"),
        rs.getBoolean("is_dismissed"),
        PriorityLevel.valueOf(rs.getString("priority_level")),
        rs.getBoolean("requires_action"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("expires_at")),
        toInstant(rs.getTimestamp("handled_at")),
        rs.getString("handled_by"),
        rs.getLong("version"),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
