/*
 * Where: Notification infrastructure configuration
 * What: Registers one JDBC-backed TransactionFeed per source feed
 * Why: Reconciliation iterates all feeds without knowing their tables
 */
package com.pimapos.notification.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pimapos.notification.feed.JdbcTransactionFeed;
import com.pimapos.notification.feed.TransactionFeed;
import com.pimapos.notification.model.SourceFeed;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@Configuration
public class TransactionFeedConfig {

  @Bean
  public TransactionFeed purchaseTransactionFeed(
      NotificationFeedProperties properties,
      NamedParameterJdbcTemplate jdbcTemplate,
      ObjectMapper objectMapper) {
    return new JdbcTransactionFeed(
        SourceFeed.PURCHASE, properties.purchaseTable(), jdbcTemplate, objectMapper);
  }

  @Bean
  public TransactionFeed saleTransactionFeed(
      NotificationFeedProperties properties,
      NamedParameterJdbcTemplate jdbcTemplate,
      ObjectMapper objectMapper) {
    return new JdbcTransactionFeed(
        SourceFeed.SALE, properties.saleTable(), jdbcTemplate, objectMapper);
  }
}
