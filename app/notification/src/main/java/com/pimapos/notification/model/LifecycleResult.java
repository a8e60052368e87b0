package com.pimapos.notification.model;

/** State after a handle/dismiss call; {@code transitioned=false} means the row was already terminal. */
public record LifecycleResult(NotificationState state, boolean transitioned) {}
