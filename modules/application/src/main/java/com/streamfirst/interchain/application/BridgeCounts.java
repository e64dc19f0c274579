package com.streamfirst.interchain.application;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/** Per-bridge counters, built fresh for every maintenance cycle. */
final class BridgeCounts {

  private final Map<Integer, MaintenanceCounts> byBridge = new TreeMap<>();

  MaintenanceCounts entry(int bridgeId) {
    return byBridge.computeIfAbsent(bridgeId, b -> new MaintenanceCounts());
  }

  MaintenanceCounts totals() {
    MaintenanceCounts totals = new MaintenanceCounts();
    byBridge.values().forEach(totals::add);
    return totals;
  }

  Map<Integer, MaintenanceCounts> snapshot() {
    Map<Integer, MaintenanceCounts> copy = new TreeMap<>();
    byBridge.forEach((bridge, counts) -> copy.put(bridge, counts.copy()));
    return Collections.unmodifiableMap(copy);
  }
}
