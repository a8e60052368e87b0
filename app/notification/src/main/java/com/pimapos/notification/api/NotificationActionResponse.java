package com.pimapos.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** {@code transitioned=false} means the notification was already handled or dismissed. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationActionResponse(boolean transitioned, NotificationView notification) {}
