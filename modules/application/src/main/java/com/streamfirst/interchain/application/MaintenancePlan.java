package com.streamfirst.interchain.application;

import com.streamfirst.interchain.application.cursor.CursorBlocksBuilder;
import com.streamfirst.interchain.domain.Consolidatable;
import com.streamfirst.interchain.domain.ConsolidatedMessage;
import com.streamfirst.interchain.domain.MessageKey;
import com.streamfirst.interchain.domain.PendingMessage;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;

/**
 * Everything one maintenance cycle decided to do, accumulated while walking the hot-tier
 * snapshot and executed afterwards by the committer and the evictor.
 *
 * @param <S> the buffered state type
 */
@Getter
final class MaintenancePlan<S extends Consolidatable<S>> {

  record Flush(MessageKey key, long version) {}

  record Eviction(MessageKey key, long version, EvictionReason reason) {}

  /** Records to write to final storage, partial and final alike. */
  private final List<ConsolidatedMessage> consolidated = new ArrayList<>();

  /** Stale entries to offload to cold storage. */
  private final List<PendingMessage<S>> staleEntries = new ArrayList<>();

  /** Finalized keys whose cold copy, if any, must go. */
  private final List<MessageKey> finalizedKeys = new ArrayList<>();

  /** Partial flushes whose last-flushed marker advances after commit. */
  private final List<Flush> flushes = new ArrayList<>();

  private final List<Eviction> evictions = new ArrayList<>();

  private final CursorBlocksBuilder cursorBlocks = new CursorBlocksBuilder();

  private final BridgeCounts counts = new BridgeCounts();

  /**
   * Folds one entry into the plan.
   *
   * <p>Final records always leave both tiers, whatever their age. Everything else stays hot
   * unless stale, in which case it is offloaded; a stale partial record is flushed as well so
   * that its progress is visible in final storage.
   */
  void collect(MessageKey key, BufferItem<S> item, ConsolidationOutcome outcome, boolean isStale) {
    MaintenanceCounts bridge = counts.entry(key.bridgeId());

    switch (outcome.kind()) {
      case UNCHANGED -> {}
      case NOT_READY -> bridge.notConsolidatable();
      case PARTIAL -> {
        consolidated.add(outcome.message());
        flushes.add(new Flush(key, item.getVersion()));
        item.markFlushed(item.getVersion());
        bridge.consolidatedNotFinal();
      }
      case COMPLETE -> {
        consolidated.add(outcome.message());
        finalizedKeys.add(key);
        evictions.add(new Eviction(key, item.getVersion(), EvictionReason.FINALIZED));
        bridge.finalized(outcome.message().transfers().size());
        cursorBlocks.mergeCold(key.bridgeId(), item.getTouchedBlocks());
        return;
      }
    }

    if (isStale) {
      staleEntries.add(item.toPending(key));
      evictions.add(new Eviction(key, item.getVersion(), EvictionReason.STALE));
      bridge.stale();
      cursorBlocks.mergeCold(key.bridgeId(), item.getTouchedBlocks());
    } else {
      bridge.hotEntry();
      cursorBlocks.mergeHot(key.bridgeId(), item.getTouchedBlocks());
    }
  }

  /** True if committing this plan would not change storage. */
  boolean isEmpty() {
    return consolidated.isEmpty()
        && staleEntries.isEmpty()
        && finalizedKeys.isEmpty()
        && !cursorBlocks.hasColdBlocks();
  }
}
