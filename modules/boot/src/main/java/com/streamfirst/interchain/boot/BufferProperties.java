package com.streamfirst.interchain.boot;

import com.streamfirst.interchain.application.BufferSettings;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Binds {@code interchain.buffer.*}. */
@Data
@ConfigurationProperties(prefix = "interchain.buffer")
public class BufferProperties {

  public enum Store {
    JDBC,
    MEMORY
  }

  /** How long an unresolved message may stay in memory before it is offloaded. */
  private Duration hotTtl = BufferSettings.DEFAULT_HOT_TTL;

  /** Delay between two maintenance cycles. */
  private Duration maintenanceInterval = BufferSettings.DEFAULT_MAINTENANCE_INTERVAL;

  private Store store = Store.JDBC;

  /** Create the tables on startup when they are missing (JDBC store only). */
  private boolean initializeSchema = true;

  public BufferSettings toSettings() {
    return new BufferSettings(hotTtl, maintenanceInterval);
  }
}
