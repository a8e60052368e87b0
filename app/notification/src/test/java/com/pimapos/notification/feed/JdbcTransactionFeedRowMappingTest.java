package com.pimapos.notification.feed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.pimapos.notification.NotificationFixtures;
import com.pimapos.notification.model.SourceFeed;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

@ExtendWith(MockitoExtension.class)
class JdbcTransactionFeedRowMappingTest {

  private static final Instant CUTOFF = Instant.parse("2026-03-01T10:00:00Z");

  @Mock private NamedParameterJdbcTemplate jdbcTemplate;

  @Test
  @SuppressWarnings({"unchecked", "rawtypes"})
  void unreadableRowsAreSkippedAndTheRestReturned() throws Exception {
    final List<ResultSet> rows =
        List.of(
            row("", CUTOFF.plusSeconds(10), "{\"id\": \"\"}"),
            row("p-1", CUTOFF.plusSeconds(20), "{not json"),
            row("p-2", null, "{\"id\": \"p-2\"}"),
            row("p-3", CUTOFF.plusSeconds(30), "{\"id\": \"p-3\"}"));
    when(jdbcTemplate.query(anyString(), any(SqlParameterSource.class), any(RowMapper.class)))
        .thenAnswer(
            invocation -> {
              final RowMapper<Object> mapper = invocation.getArgument(2);
              final List<Object> mapped = new ArrayList<>();
              for (int i = 0; i < rows.size(); i++) {
                mapped.add(mapper.mapRow(rows.get(i), i));
              }
              return mapped;
            });
    final JdbcTransactionFeed feed =
        new JdbcTransactionFeed(
            SourceFeed.PURCHASE, "transactions", jdbcTemplate, NotificationFixtures.objectMapper());

    final List<TransactionRecord> records = feed.listCreatedSince(CUTOFF);

    assertThat(records).extracting(TransactionRecord::id).containsExactly("p-3");
    assertThat(records.get(0).payload().path("id").asText()).isEqualTo("p-3");
  }

  private static ResultSet row(String id, Instant createdAt, String json) throws SQLException {
    final ResultSet rs = mock(ResultSet.class);
    when(rs.getString("id")).thenReturn(id);
    when(rs.getTimestamp("created_at"))
        .thenReturn(createdAt == null ? null : Timestamp.from(createdAt));
    when(rs.getString("record_json")).thenReturn(json);
    return rs;
  }
}
