/*
 * Where: Notification API model
 * What: One notification as shown on the dashboard
 * Why: Exposes the derived status and the payload snapshot as JSON rather than raw columns
 */
package com.pimapos.notification.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.pimapos.notification.model.NotificationEventType;
import com.pimapos.notification.model.NotificationStatus;
import com.pimapos.notification.model.PriorityLevel;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationView(
    UUID id,
    String feed,
    String transactionTable,
    String transactionId,
    NotificationEventType eventType,
    NotificationStatus status,
    PriorityLevel priorityLevel,
    boolean requiresAction,
    Instant createdAt,
    Instant expiresAt,
    Instant handledAt,
    String handledBy,
    long version,
    JsonNode payload) {}
