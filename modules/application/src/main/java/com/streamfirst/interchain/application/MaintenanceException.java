package com.streamfirst.interchain.application;

/**
 * A maintenance cycle failed. Nothing of the cycle was committed and the hot tier is
 * untouched, so the next cycle retries from scratch.
 */
public class MaintenanceException extends RuntimeException {

  private final MaintenancePhase phase;

  public MaintenanceException(MaintenancePhase phase, Throwable cause) {
    super("Maintenance failed to " + phase.description() + ": " + cause.getMessage(), cause);
    this.phase = phase;
  }

  public MaintenancePhase getPhase() {
    return phase;
  }
}
