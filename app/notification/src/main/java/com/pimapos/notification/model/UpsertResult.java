package com.pimapos.notification.model;

/** Outcome of an insert-if-absent: {@code created=false} carries the row that already existed. */
public record UpsertResult(boolean created, NotificationState state) {}
