/*
 * Where: Transaction feed adapter
 * What: Reads recently created rows of a feed table over JDBC
 * Why: Purchases and sales live in the same PostgreSQL database as the notification tables
 */
package com.pimapos.notification.feed;

import static com.pimapos.common.JdbcTimestampUtils.toInstant;
import static com.pimapos.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pimapos.notification.model.SourceFeed;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

public class JdbcTransactionFeed implements TransactionFeed {

  private static final Logger logger = LoggerFactory.getLogger(JdbcTransactionFeed.class);

  private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

  private final SourceFeed sourceFeed;
  private final String table;
  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public JdbcTransactionFeed(
      SourceFeed sourceFeed,
      String table,
      NamedParameterJdbcTemplate jdbcTemplate,
      ObjectMapper objectMapper) {
    this.sourceFeed = Objects.requireNonNull(sourceFeed, "sourceFeed");
    // The table name is spliced into SQL, so only plain identifiers are accepted.
    if (table == null || !TABLE_NAME.matcher(table).matches()) {
      throw new IllegalArgumentException("invalid feed table name: " + table);
    }
    this.table = table;
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
  }

  @Override
  public SourceFeed sourceFeed() {
    return sourceFeed;
  }

  public String table() {
    return table;
  }

  /** Rows that cannot be turned into a {@link TransactionRecord} are logged and skipped. */
  @Override
  public List<TransactionRecord> listCreatedSince(Instant since) {
    Objects.requireNonNull(since, "since");
    final String sql =
        "SELECT t.id::text AS id, t.created_at, to_jsonb(t)::text AS record_json "
            + "FROM " + table + " t "
            + "WHERE t.created_at >= :since "
            + "ORDER BY t.created_at";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("since", toTimestamp(since));
    final List<FeedRow> rows;
    try {
      rows = jdbcTemplate.query(sql, params, this::mapRow);
    } catch (DataAccessException ex) {
      throw new FeedUnavailableException(
          sourceFeed, "failed to read feed " + sourceFeed.wireName() + " from " + table, ex);
    }
    final List<TransactionRecord> records = new ArrayList<>(rows.size());
    for (FeedRow row : rows) {
      try {
        records.add(row.toRecord(objectMapper));
      } catch (IllegalArgumentException | JsonProcessingException ex) {
        logger.warn(
            "feed row skipped feed={} table={} id={} createdAt={}",
            sourceFeed.wireName(),
            table,
            row.id(),
            row.createdAt(),
            ex);
      }
    }
    return records;
  }

  private FeedRow mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new FeedRow(
        rs.getString("id"), toInstant(rs.getTimestamp("created_at")), rs.getString("record_json"));
  }

  /** One row as read, before it is checked. */
  private record FeedRow(String id, Instant createdAt, String recordJson) {

    TransactionRecord toRecord(ObjectMapper objectMapper) throws JsonProcessingException {
      if (createdAt == null) {
        throw new IllegalArgumentException("created_at is required");
      }
      final JsonNode payload = recordJson == null ? null : objectMapper.readTree(recordJson);
      return new TransactionRecord(id, createdAt, payload);
    }
  }
}
