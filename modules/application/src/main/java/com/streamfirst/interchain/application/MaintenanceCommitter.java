package com.streamfirst.interchain.application;

import com.streamfirst.interchain.domain.Consolidatable;
import com.streamfirst.interchain.domain.Cursor;
import com.streamfirst.interchain.domain.CursorKey;
import com.streamfirst.interchain.ports.InterchainStorePort;
import com.streamfirst.interchain.ports.StorageSession;
import java.util.Map;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies the storage side of a {@link MaintenancePlan} in one transaction:
 * offload, flush, pending cleanup, then cursor update.
 *
 * @param <S> the buffered state type
 */
@Slf4j
@RequiredArgsConstructor
final class MaintenanceCommitter<S extends Consolidatable<S>> {

  private final InterchainStorePort<S> store;

  /**
   * @return the cursors written
   * @throws MaintenanceException naming the failed phase; the transaction was rolled back
   */
  Map<CursorKey, Cursor> commit(MaintenancePlan<S> plan) {
    if (plan.isEmpty()) {
      return Map.of();
    }
    try {
      return store.inTransaction(session -> apply(session, plan));
    } catch (MaintenanceException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new MaintenanceException(MaintenancePhase.COMMIT, e);
    }
  }

  private Map<CursorKey, Cursor> apply(StorageSession<S> session, MaintenancePlan<S> plan) {
    if (!plan.getStaleEntries().isEmpty()) {
      run(MaintenancePhase.OFFLOAD, () -> session.pendingMessages().offload(plan.getStaleEntries()));
    }
    if (!plan.getConsolidated().isEmpty()) {
      run(MaintenancePhase.FLUSH, () -> session.finalStorage().upsert(plan.getConsolidated()));
    }
    if (!plan.getFinalizedKeys().isEmpty()) {
      run(
          MaintenancePhase.DELETE_PENDING,
          () -> session.pendingMessages().deleteByKeys(plan.getFinalizedKeys()));
    }
    if (!plan.getCursorBlocks().hasColdBlocks()) {
      return Map.of();
    }

    Map<CursorKey, Cursor> previous =
        call(MaintenancePhase.FETCH_CURSORS, () -> session.cursors().fetch(plan.getCursorBlocks().keys()));
    Map<CursorKey, Cursor> updated = plan.getCursorBlocks().calculateUpdates(previous);
    if (!updated.isEmpty()) {
      run(MaintenancePhase.UPSERT_CURSORS, () -> session.cursors().upsert(updated));
    }
    log.debug("Cursor update: {} -> {}", previous, updated);
    return updated;
  }

  private static void run(MaintenancePhase phase, Runnable step) {
    call(
        phase,
        () -> {
          step.run();
          return null;
        });
  }

  private static <T> T call(MaintenancePhase phase, Supplier<T> step) {
    try {
      return step.get();
    } catch (RuntimeException e) {
      throw new MaintenanceException(phase, e);
    }
  }
}
