package com.streamfirst.interchain.application.cursor;

import com.streamfirst.interchain.domain.Cursor;
import com.streamfirst.interchain.domain.CursorKey;
import com.streamfirst.interchain.domain.TouchedBlocks;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Per-bridge, per-chain accumulator of the blocks touched by entries processed in one
 * maintenance cycle. Feeds the cursor update at commit time.
 */
public final class CursorBlocksBuilder {

  private final Map<CursorKey, BlockSets> sets = new TreeMap<>();

  /** Records blocks of an entry that leaves the hot tier this cycle. */
  public void mergeCold(int bridgeId, TouchedBlocks touched) {
    for (Long chainId : touched.chains()) {
      setsFor(bridgeId, chainId).addCold(touched.blocks(chainId));
    }
  }

  /** Records blocks of an entry that stays in the hot tier. */
  public void mergeHot(int bridgeId, TouchedBlocks touched) {
    for (Long chainId : touched.chains()) {
      setsFor(bridgeId, chainId).addHot(touched.blocks(chainId));
    }
  }

  public Set<CursorKey> keys() {
    return Collections.unmodifiableSet(sets.keySet());
  }

  public Optional<BlockSets> get(CursorKey key) {
    return Optional.ofNullable(sets.get(key));
  }

  public boolean isEmpty() {
    return sets.isEmpty();
  }

  /**
   * True if some entry left the hot tier this cycle. Without cold blocks no cursor can move
   * and no missing cursor can be bootstrapped.
   */
  public boolean hasColdBlocks() {
    return sets.values().stream().anyMatch(blocks -> !blocks.cold().isEmpty());
  }

  /**
   * Computes new cursors for every touched key. Existing cursors are extended and never move
   * backwards; keys without a cursor are bootstrapped, and left out when nothing coverable was
   * touched.
   *
   * @param existing cursors currently persisted for (a subset of) {@link #keys()}
   * @return the cursors to persist
   */
  public Map<CursorKey, Cursor> calculateUpdates(Map<CursorKey, Cursor> existing) {
    Map<CursorKey, Cursor> updates = new TreeMap<>();
    sets.forEach(
        (key, blocks) -> {
          Cursor previous = existing.get(key);
          if (previous != null) {
            updates.put(key, blocks.extend(previous).notBehind(previous));
          } else {
            blocks.bootstrap().ifPresent(cursor -> updates.put(key, cursor));
          }
        });
    return updates;
  }

  private BlockSets setsFor(int bridgeId, long chainId) {
    return sets.computeIfAbsent(new CursorKey(bridgeId, chainId), k -> new BlockSets());
  }
}
