package com.streamfirst.interchain.application;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning of the message buffer.
 *
 * @param hotTtl how long an unresolved entry may stay in memory before it is offloaded to cold
 *     storage. A performance knob, not a durability boundary.
 * @param maintenanceInterval delay between two maintenance cycles of the background loop
 */
public record BufferSettings(Duration hotTtl, Duration maintenanceInterval) {

  public static final Duration DEFAULT_HOT_TTL = Duration.ofSeconds(10);
  public static final Duration DEFAULT_MAINTENANCE_INTERVAL = Duration.ofMillis(500);

  public BufferSettings {
    Objects.requireNonNull(hotTtl, "Hot TTL cannot be null");
    Objects.requireNonNull(maintenanceInterval, "Maintenance interval cannot be null");
    if (hotTtl.isNegative() || hotTtl.isZero()) {
      throw new IllegalArgumentException("Hot TTL must be positive: " + hotTtl);
    }
    if (maintenanceInterval.isNegative() || maintenanceInterval.isZero()) {
      throw new IllegalArgumentException(
          "Maintenance interval must be positive: " + maintenanceInterval);
    }
  }

  public static BufferSettings defaults() {
    return new BufferSettings(DEFAULT_HOT_TTL, DEFAULT_MAINTENANCE_INTERVAL);
  }
}
