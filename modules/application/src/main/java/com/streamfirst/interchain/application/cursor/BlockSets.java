package com.streamfirst.interchain.application.cursor;

import com.streamfirst.interchain.domain.Cursor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Blocks of one bridge on one chain, split by what happened to the entries that touched them
 * during a maintenance cycle.
 *
 * <ul>
 *   <li><strong>Cold</strong> blocks belong to entries that left the hot tier this cycle
 *       (finalized or offloaded). Their work is done as far as the cursor is concerned.
 *   <li><strong>Hot</strong> blocks belong to entries still waiting in memory. They are
 *       barriers: a cursor never moves across one.
 * </ul>
 *
 * A cursor represents scan coverage rather than event locations, so it bridges the gaps
 * between cold blocks (scanned but empty) and stops on the block right before a barrier.
 */
public final class BlockSets {

  private final TreeSet<Long> cold = new TreeSet<>();
  private final TreeSet<Long> hot = new TreeSet<>();

  public static BlockSets of(Collection<Long> cold, Collection<Long> hot) {
    BlockSets sets = new BlockSets();
    sets.cold.addAll(cold);
    sets.hot.addAll(hot);
    return sets;
  }

  void addCold(Collection<Long> blocks) {
    cold.addAll(blocks);
  }

  void addHot(Collection<Long> blocks) {
    hot.addAll(blocks);
  }

  public NavigableSet<Long> cold() {
    return Collections.unmodifiableNavigableSet(cold);
  }

  public NavigableSet<Long> hot() {
    return Collections.unmodifiableNavigableSet(hot);
  }

  /** Moves both boundaries of an existing cursor as far as the cold blocks allow. */
  public Cursor extend(Cursor cursor) {
    long backward = extendBoundary(ScanDirection.BACKWARD, cursor.backward(), cold, hot);
    long forward = extendBoundary(ScanDirection.FORWARD, cursor.forward(), cold, hot);
    return new Cursor(backward, forward);
  }

  /**
   * Picks an initial cursor: the widest run of cold blocks not interrupted by a hot block.
   * Cold blocks that are also hot can never be covered and are ignored.
   *
   * @return empty if there is no coverable cold block
   */
  public Optional<Cursor> bootstrap() {
    List<Long> scannable = new ArrayList<>();
    for (Long block : cold) {
      if (!hot.contains(block)) {
        scannable.add(block);
      }
    }
    if (scannable.isEmpty()) {
      return Optional.empty();
    }

    long bestStart = scannable.get(0);
    long bestEnd = scannable.get(0);
    long bestWidth = 0;
    long currentStart = scannable.get(0);

    for (int i = 1; i < scannable.size(); i++) {
      long previous = scannable.get(i - 1);
      long block = scannable.get(i);

      // a hot block between two cold ones splits the run
      if (!hot.subSet(previous + 1, true, block, false).isEmpty()) {
        currentStart = block;
      }

      long width = block - currentStart;
      if (width > bestWidth) {
        bestWidth = width;
        bestStart = currentStart;
        bestEnd = block;
      }
    }

    return Optional.of(new Cursor(bestStart, bestEnd));
  }

  /**
   * Walks cold blocks away from {@code boundary}, bridging gaps, until a cold block is itself
   * hot or a hot block sits in the gap before the next cold block. In the latter case the
   * boundary lands right next to the hot block.
   */
  static long extendBoundary(
      ScanDirection direction, long boundary, NavigableSet<Long> cold, NavigableSet<Long> hot) {
    long newBoundary = boundary;
    long lastScanned = boundary;

    Iterator<Long> blocks =
        direction == ScanDirection.BACKWARD
            ? cold.headSet(boundary, false).descendingIterator()
            : cold.tailSet(boundary, false).iterator();

    while (blocks.hasNext()) {
      long block = blocks.next();
      if (hot.contains(block)) {
        break;
      }

      Long barrier =
          direction == ScanDirection.BACKWARD
              ? lastInRange(hot, block + 1, lastScanned)
              : firstInRange(hot, lastScanned + 1, block);

      if (barrier != null) {
        newBoundary = direction == ScanDirection.BACKWARD ? barrier + 1 : barrier - 1;
        break;
      }

      newBoundary = block;
      lastScanned = block;
    }

    return newBoundary;
  }

  /** Highest element in {@code [from, to)}, or null. */
  private static Long lastInRange(NavigableSet<Long> set, long from, long to) {
    if (from >= to) {
      return null;
    }
    NavigableSet<Long> range = set.subSet(from, true, to, false);
    return range.isEmpty() ? null : range.last();
  }

  /** Lowest element in {@code [from, to)}, or null. */
  private static Long firstInRange(NavigableSet<Long> set, long from, long to) {
    if (from >= to) {
      return null;
    }
    NavigableSet<Long> range = set.subSet(from, true, to, false);
    return range.isEmpty() ? null : range.first();
  }

  @Override
  public String toString() {
    return "BlockSets{cold=" + cold + ", hot=" + hot + '}';
  }
}
