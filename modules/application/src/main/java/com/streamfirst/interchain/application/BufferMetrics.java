package com.streamfirst.interchain.application;

import com.streamfirst.interchain.domain.Cursor;
import com.streamfirst.interchain.domain.CursorKey;
import com.streamfirst.interchain.ports.MetricsPort;
import java.util.Map;
import lombok.RequiredArgsConstructor;

/** Names of the buffer's metrics and the mapping of a maintenance report onto them. */
@RequiredArgsConstructor
public final class BufferMetrics {

  public static final String MAINTENANCE_ENTRIES = "interchain_buffer_maintenance_entries";
  public static final String EVICTED_ENTRIES = "interchain_buffer_evicted_entries";
  public static final String EVICTION_SKIPPED_TOTAL = "interchain_buffer_eviction_skipped_total";
  public static final String MESSAGES_FINALIZED_TOTAL =
      "interchain_buffer_messages_finalized_total";
  public static final String TRANSFERS_FINALIZED_TOTAL =
      "interchain_buffer_transfers_finalized_total";
  public static final String HOT_ENTRIES = "interchain_buffer_hot_entries";
  public static final String CURSOR = "interchain_buffer_cursor";
  public static final String MAINTENANCE_DURATION = "interchain_buffer_maintenance_duration_seconds";
  public static final String MAINTENANCE_ERRORS_TOTAL = "interchain_buffer_maintenance_errors_total";
  public static final String RESTORE_TOTAL = "interchain_buffer_restore_total";

  public static final String LABEL_BRIDGE = "bridge";
  public static final String LABEL_CHAIN = "chain";
  public static final String LABEL_STATE = "state";
  public static final String LABEL_REASON = "reason";
  public static final String LABEL_KIND = "kind";
  public static final String LABEL_RESULT = "result";

  private final MetricsPort metrics;

  void record(MaintenanceReport report) {
    report.countsByBridge().forEach(this::recordBridge);
    report.cursors().forEach(this::recordCursor);
    metrics.observe(MAINTENANCE_DURATION, report.duration().toNanos() / 1e9);
  }

  void recordFailure() {
    metrics.increment(MAINTENANCE_ERRORS_TOTAL, 1);
  }

  private void recordBridge(Integer bridgeId, MaintenanceCounts counts) {
    String bridge = String.valueOf(bridgeId);

    metrics.gauge(MAINTENANCE_ENTRIES, state(bridge, "not_consolidatable"), counts.getNotConsolidatable());
    metrics.gauge(
        MAINTENANCE_ENTRIES, state(bridge, "consolidated_not_final"), counts.getConsolidatedNotFinal());
    metrics.gauge(MAINTENANCE_ENTRIES, state(bridge, "stale"), counts.getStale());

    metrics.observe(
        EVICTED_ENTRIES, Map.of(LABEL_BRIDGE, bridge, LABEL_REASON, "stale"), counts.getRemovedStale());
    metrics.observe(
        EVICTED_ENTRIES,
        Map.of(LABEL_BRIDGE, bridge, LABEL_REASON, "finalized"),
        counts.getRemovedFinalized());

    Map<String, String> bridgeOnly = Map.of(LABEL_BRIDGE, bridge);
    metrics.increment(EVICTION_SKIPPED_TOTAL, bridgeOnly, counts.getSkippedModified());
    metrics.increment(MESSAGES_FINALIZED_TOTAL, bridgeOnly, counts.getFinalizedMessages());
    metrics.increment(TRANSFERS_FINALIZED_TOTAL, bridgeOnly, counts.getFinalizedTransfers());
    metrics.gauge(HOT_ENTRIES, bridgeOnly, counts.getHotEntries());
  }

  private void recordCursor(CursorKey key, Cursor cursor) {
    String bridge = String.valueOf(key.bridgeId());
    String chain = String.valueOf(key.chainId());
    metrics.gauge(
        CURSOR,
        Map.of(LABEL_BRIDGE, bridge, LABEL_CHAIN, chain, LABEL_KIND, "catchup"),
        cursor.backward());
    metrics.gauge(
        CURSOR,
        Map.of(LABEL_BRIDGE, bridge, LABEL_CHAIN, chain, LABEL_KIND, "realtime"),
        cursor.forward());
  }

  private static Map<String, String> state(String bridge, String state) {
    return Map.of(LABEL_BRIDGE, bridge, LABEL_STATE, state);
  }
}
