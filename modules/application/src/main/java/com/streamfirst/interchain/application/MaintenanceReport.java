package com.streamfirst.interchain.application;

import com.streamfirst.interchain.domain.Cursor;
import com.streamfirst.interchain.domain.CursorKey;
import java.time.Duration;
import java.util.Map;

/**
 * Outcome of one successful maintenance cycle.
 *
 * @param countsByBridge per-bridge counters
 * @param totals counters summed over all bridges
 * @param cursors cursors written by the cycle
 * @param consolidated number of records written to final storage
 * @param hotSize entries left in the hot tier afterwards
 * @param duration wall time of the cycle
 */
public record MaintenanceReport(
    Map<Integer, MaintenanceCounts> countsByBridge,
    MaintenanceCounts totals,
    Map<CursorKey, Cursor> cursors,
    int consolidated,
    int hotSize,
    Duration duration) {

  public MaintenanceCounts countsFor(int bridgeId) {
    return countsByBridge.getOrDefault(bridgeId, new MaintenanceCounts());
  }
}
