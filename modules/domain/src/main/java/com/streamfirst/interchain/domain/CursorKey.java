package com.streamfirst.interchain.domain;

import java.util.Comparator;

/**
 * Addresses one indexing checkpoint: a bridge observed on a single chain.
 *
 * @param bridgeId the bridge
 * @param chainId the chain whose blocks the checkpoint refers to
 */
public record CursorKey(int bridgeId, long chainId) implements Comparable<CursorKey> {

  private static final Comparator<CursorKey> ORDER =
      Comparator.comparingInt(CursorKey::bridgeId).thenComparingLong(CursorKey::chainId);

  @Override
  public int compareTo(CursorKey other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return bridgeId + "@" + chainId;
  }
}
