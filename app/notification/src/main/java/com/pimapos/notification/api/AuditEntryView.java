package com.pimapos.notification.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.pimapos.notification.model.AuditAction;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditEntryView(
    UUID auditId, AuditAction action, String actor, Instant occurredAt, JsonNode state) {}
