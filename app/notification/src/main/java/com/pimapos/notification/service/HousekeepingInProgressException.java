package com.pimapos.notification.service;

/** A manual housekeeping run was requested while a tick was already running. */
public class HousekeepingInProgressException extends RuntimeException {

  public HousekeepingInProgressException() {
    super("housekeeping tick already running");
  }
}
