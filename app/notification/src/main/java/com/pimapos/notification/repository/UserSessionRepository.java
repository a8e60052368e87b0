/*
 * Where: Notification data access
 * What: Deletes stale rows from the dashboard's user_sessions table
 * Why: Sessions are registered by every dashboard tab and never removed by the client
 */
package com.pimapos.notification.repository;

import static com.pimapos.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UserSessionRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int deleteInactiveOrLastSeenBefore(Instant threshold) {
    final String sql =
        """
        DELETE FROM user_sessions
        WHERE is_active = FALSE
           OR last_seen < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }
}
