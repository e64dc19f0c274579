package com.streamfirst.interchain.application;

import com.streamfirst.interchain.domain.Consolidatable;
import com.streamfirst.interchain.domain.MessageKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Classifies every entry of a hot-tier snapshot and folds the result into a
 * {@link MaintenancePlan}. Performs no I/O.
 *
 * @param <S> the buffered state type
 */
@Slf4j
@RequiredArgsConstructor
final class MaintenancePlanner<S extends Consolidatable<S>> {

  private final Duration hotTtl;

  MaintenancePlan<S> plan(Map<MessageKey, BufferItem<S>> snapshot, Instant now) {
    MaintenancePlan<S> plan = new MaintenancePlan<>();
    snapshot.forEach(
        (key, item) -> {
          boolean isStale = isStale(item, now);
          ConsolidationOutcome outcome = classify(key, item);
          log.trace("Entry {} v{} classified {} (stale={})", key, item.getVersion(), outcome.kind(), isStale);
          plan.collect(key, item, outcome, isStale);
        });
    return plan;
  }

  boolean isStale(BufferItem<S> item, Instant now) {
    Duration age = Duration.between(item.getHotSince(), now);
    if (age.isNegative()) {
      age = Duration.ZERO;
    }
    return age.compareTo(hotTtl) >= 0;
  }

  /**
   * Attempts consolidation of a dirty entry. A failure aborts the whole cycle: skipping the key
   * would let the cursors move past data that was never consolidated.
   *
   * @throws MaintenanceException in phase {@link MaintenancePhase#CONSOLIDATE}
   */
  static <S extends Consolidatable<S>> ConsolidationOutcome classify(
      MessageKey key, BufferItem<S> item) {
    if (!item.isDirty()) {
      return ConsolidationOutcome.UNCHANGED;
    }
    try {
      return item.getState()
          .consolidate(key)
          .map(ConsolidationOutcome::of)
          .orElse(ConsolidationOutcome.NOT_READY);
    } catch (RuntimeException e) {
      throw new MaintenanceException(MaintenancePhase.CONSOLIDATE, e);
    }
  }
}
