package com.streamfirst.interchain.application;

import com.streamfirst.interchain.domain.Consolidatable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Post-commit half of a maintenance cycle: advances flush markers and removes entries that
 * were persisted, unless ingestion modified them after the snapshot.
 *
 * @param <S> the buffered state type
 */
@Slf4j
@RequiredArgsConstructor
final class HotTierEvictor<S extends Consolidatable<S>> {

  private final MessageBuffer<S> buffer;

  void apply(MaintenancePlan<S> plan) {
    for (MaintenancePlan.Flush flush : plan.getFlushes()) {
      if (!buffer.markFlushed(flush.key(), flush.version())) {
        log.debug("Entry {} moved past v{} before its flush was recorded", flush.key(), flush.version());
      }
    }

    for (MaintenancePlan.Eviction eviction : plan.getEvictions()) {
      MaintenanceCounts counts = plan.getCounts().entry(eviction.key().bridgeId());
      if (buffer.removeIfVersion(eviction.key(), eviction.version())) {
        counts.removed(eviction.reason());
      } else {
        log.debug(
            "Skipped {} eviction of {}: modified after v{}",
            eviction.reason(),
            eviction.key(),
            eviction.version());
        counts.skippedModified();
      }
    }
  }
}
