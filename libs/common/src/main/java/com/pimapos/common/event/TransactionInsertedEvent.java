/*
 * Where: Common event payload
 * What: JSON body published when a purchase or sale row is inserted
 * Why: The point-of-sale publisher and the notification engine share one wire shape
 */
package com.pimapos.common.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Live insert event for one feed row.
 *
 * @param feed {@code purchase} or {@code sale}
 * @param transactionId primary key of the inserted row
 * @param createdAt ISO-8601 creation time of the row
 * @param record the inserted row as written by the point-of-sale
 * @param traceId optional trace id propagated into the log MDC
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TransactionInsertedEvent(
    String feed, String transactionId, String createdAt, JsonNode record, String traceId) {}
