package com.streamfirst.interchain.application;

import com.streamfirst.interchain.domain.Consolidatable;
import com.streamfirst.interchain.domain.Cursor;
import com.streamfirst.interchain.domain.CursorKey;
import com.streamfirst.interchain.domain.MessageKey;
import com.streamfirst.interchain.ports.InterchainStorePort;
import com.streamfirst.interchain.ports.MetricsPort;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Maintenance cycle of the message buffer.
 *
 * <p>One cycle:
 *
 * <ol>
 *   <li>snapshots the hot tier and classifies every entry (consolidation + staleness);
 *   <li>in a single storage transaction, offloads stale entries to pending storage, upserts
 *       consolidated records into final storage, drops pending rows of finalized messages and
 *       moves the per-chain cursors;
 *   <li>after commit, advances flush markers of partial records and evicts persisted entries,
 *       skipping any entry modified after the snapshot.
 * </ol>
 *
 * A failed cycle changes nothing and is simply retried by the next one. Cycles never overlap;
 * ingestion is never blocked by a running cycle.
 *
 * @param <S> the buffered state type
 */
@Slf4j
public class BufferMaintenance<S extends Consolidatable<S>> {

  private final MessageBuffer<S> buffer;
  private final MaintenancePlanner<S> planner;
  private final MaintenanceCommitter<S> committer;
  private final HotTierEvictor<S> evictor;
  private final BufferMetrics metrics;
  private final ReentrantLock cycleLock = new ReentrantLock();

  public BufferMaintenance(
      @NonNull MessageBuffer<S> buffer,
      @NonNull InterchainStorePort<S> store,
      @NonNull BufferSettings settings,
      @NonNull MetricsPort metrics) {
    this.buffer = buffer;
    this.planner = new MaintenancePlanner<>(settings.hotTtl());
    this.committer = new MaintenanceCommitter<>(store);
    this.evictor = new HotTierEvictor<>(buffer);
    this.metrics = new BufferMetrics(metrics);
  }

  /**
   * Runs one maintenance cycle, waiting for a running one to finish first.
   *
   * @return what the cycle did
   * @throws MaintenanceException if the cycle failed; nothing was committed
   */
  public MaintenanceReport run() {
    cycleLock.lock();
    try {
      long started = System.nanoTime();

      Map<MessageKey, BufferItem<S>> snapshot = takeSnapshot();
      MaintenancePlan<S> plan = planner.plan(snapshot, buffer.clock().instant());
      Map<CursorKey, Cursor> cursors = committer.commit(plan);
      evictor.apply(plan);

      MaintenanceReport report =
          new MaintenanceReport(
              plan.getCounts().snapshot(),
              plan.getCounts().totals(),
              cursors,
              plan.getConsolidated().size(),
              buffer.hotSize(),
              Duration.ofNanos(System.nanoTime() - started));

      MaintenanceCounts totals = report.totals();
      log.info(
          "Maintenance completed: hot={} consolidated={} partial={} stale={} finalized={}"
              + " not_consolidatable={} removed_stale={} removed_finalized={} skipped={} in {} ms",
          report.hotSize(),
          report.consolidated(),
          totals.getConsolidatedNotFinal(),
          totals.getStale(),
          totals.getFinalizedMessages(),
          totals.getNotConsolidatable(),
          totals.getRemovedStale(),
          totals.getRemovedFinalized(),
          totals.getSkippedModified(),
          report.duration().toMillis());
      if (totals.getSkippedModified() > 0) {
        log.warn(
            "{} evictions skipped because entries changed during maintenance",
            totals.getSkippedModified());
      }

      metrics.record(report);
      return report;
    } finally {
      cycleLock.unlock();
    }
  }

  void recordFailure() {
    metrics.recordFailure();
  }

  private Map<MessageKey, BufferItem<S>> takeSnapshot() {
    try {
      return buffer.snapshot();
    } catch (RuntimeException e) {
      throw new MaintenanceException(MaintenancePhase.SNAPSHOT, e);
    }
  }
}
