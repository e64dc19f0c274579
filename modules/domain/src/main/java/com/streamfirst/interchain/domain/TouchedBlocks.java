package com.streamfirst.interchain.domain;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Blocks, per chain, that contributed observations to a buffered message.
 * Mutable and not thread-safe; the hot tier only touches it under the owning key's lock.
 */
public final class TouchedBlocks {

  private final TreeMap<Long, TreeSet<Long>> blocksByChain = new TreeMap<>();

  public static TouchedBlocks of(Map<Long, ? extends Iterable<Long>> blocks) {
    TouchedBlocks touched = new TouchedBlocks();
    blocks.forEach((chainId, numbers) -> numbers.forEach(n -> touched.record(chainId, n)));
    return touched;
  }

  public TouchedBlocks record(long chainId, long blockNumber) {
    blocksByChain.computeIfAbsent(chainId, c -> new TreeSet<>()).add(blockNumber);
    return this;
  }

  public Set<Long> chains() {
    return Collections.unmodifiableSet(blocksByChain.keySet());
  }

  public NavigableSet<Long> blocks(long chainId) {
    TreeSet<Long> blocks = blocksByChain.get(chainId);
    return blocks == null
        ? Collections.emptyNavigableSet()
        : Collections.unmodifiableNavigableSet(blocks);
  }

  public Map<Long, NavigableSet<Long>> asMap() {
    Map<Long, NavigableSet<Long>> view = new TreeMap<>();
    blocksByChain.forEach((chain, blocks) -> view.put(chain, blocks(chain)));
    return Collections.unmodifiableMap(view);
  }

  public boolean isEmpty() {
    return blocksByChain.isEmpty();
  }

  public TouchedBlocks copy() {
    TouchedBlocks copy = new TouchedBlocks();
    blocksByChain.forEach((chain, blocks) -> copy.blocksByChain.put(chain, new TreeSet<>(blocks)));
    return copy;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof TouchedBlocks other && blocksByChain.equals(other.blocksByChain);
  }

  @Override
  public int hashCode() {
    return blocksByChain.hashCode();
  }

  @Override
  public String toString() {
    return blocksByChain.toString();
  }
}
