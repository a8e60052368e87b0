package com.pimapos.notification.api;

import jakarta.validation.constraints.NotBlank;

/** Body of the handle and dismiss endpoints. */
public record NotificationActionRequest(@NotBlank(message = "actor is required") String actor) {}
