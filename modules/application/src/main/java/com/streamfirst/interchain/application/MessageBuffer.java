package com.streamfirst.interchain.application;

import com.streamfirst.interchain.domain.Consolidatable;
import com.streamfirst.interchain.domain.MessageKey;
import com.streamfirst.interchain.domain.PendingMessage;
import com.streamfirst.interchain.ports.InterchainStorePort;
import com.streamfirst.interchain.ports.MetricsPort;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Hot tier of the message buffer: in-flight message state keyed by {@link MessageKey}.
 *
 * <p>Ingestion mutates entries through {@link #alter}; each key is updated exclusively and
 * independently of other keys, with no lock spanning the whole map. Entries that are absent
 * from memory are first looked up in cold storage so that offloaded progress is never lost.
 *
 * <p>Entries only leave the hot tier through {@link #removeIfVersion}, which the maintenance
 * cycle calls after its storage transaction committed.
 *
 * @param <S> the buffered state type
 */
@Slf4j
public class MessageBuffer<S extends Consolidatable<S>> {

  private final ConcurrentHashMap<MessageKey, BufferItem<S>> hot = new ConcurrentHashMap<>();

  private final Supplier<S> stateFactory;
  private final InterchainStorePort<S> store;
  private final MetricsPort metrics;
  private final Clock clock;

  public MessageBuffer(
      @NonNull Supplier<S> stateFactory,
      @NonNull InterchainStorePort<S> store,
      @NonNull MetricsPort metrics,
      @NonNull Clock clock) {
    this.stateFactory = stateFactory;
    this.store = store;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * Applies an observation to a message, creating or re-admitting its entry as needed.
   * Bumps the entry version and records the block that produced the observation.
   *
   * @param key the message
   * @param chainId chain the observation was read from
   * @param blockNumber block the observation was read from
   * @param mutator folds the observation into the message state
   * @throws com.streamfirst.interchain.ports.StorageException if cold storage cannot be read
   */
  public void alter(MessageKey key, long chainId, long blockNumber, Consumer<S> mutator) {
    while (true) {
      BufferItem<S> seed = hot.containsKey(key) ? null : restoreOrCreate(key);
      AtomicBoolean applied = new AtomicBoolean();

      hot.compute(
          key,
          (k, current) -> {
            BufferItem<S> target = current != null ? current : seed;
            if (target == null) {
              // evicted between the presence check and now; look in cold storage again
              return null;
            }
            mutator.accept(target.getState());
            target.recordBlock(chainId, blockNumber);
            target.touch();
            applied.set(true);
            return target;
          });

      if (applied.get()) {
        return;
      }
      log.debug("Entry {} was evicted concurrently, retrying restore", key);
    }
  }

  /** Number of entries currently held in memory. */
  public int hotSize() {
    return hot.size();
  }

  /** Copy of the entry for {@code key}, if it is in the hot tier. */
  public Optional<BufferItem<S>> snapshotOf(MessageKey key) {
    AtomicReference<BufferItem<S>> copy = new AtomicReference<>();
    hot.computeIfPresent(
        key,
        (k, item) -> {
          copy.set(item.snapshot());
          return item;
        });
    return Optional.ofNullable(copy.get());
  }

  /**
   * Copies every entry, each one consistent as of the moment its key was visited.
   * Only the visited key is locked while it is copied.
   */
  Map<MessageKey, BufferItem<S>> snapshot() {
    Map<MessageKey, BufferItem<S>> snapshot = new TreeMap<>();
    for (MessageKey key : hot.keySet()) {
      snapshotOf(key).ifPresent(item -> snapshot.put(key, item));
    }
    return snapshot;
  }

  /**
   * Removes the entry only if nobody modified it since {@code expectedVersion} was read.
   *
   * @return true if the entry was removed
   */
  boolean removeIfVersion(MessageKey key, long expectedVersion) {
    AtomicBoolean removed = new AtomicBoolean();
    hot.computeIfPresent(
        key,
        (k, item) -> {
          if (item.getVersion() != expectedVersion) {
            return item;
          }
          removed.set(true);
          return null;
        });
    return removed.get();
  }

  /**
   * Records that {@code version} of the entry was written to final storage, provided the entry
   * still is at that version.
   *
   * @return true if the marker was advanced
   */
  boolean markFlushed(MessageKey key, long version) {
    AtomicBoolean marked = new AtomicBoolean();
    hot.computeIfPresent(
        key,
        (k, item) -> {
          if (item.getVersion() == version) {
            item.markFlushed(version);
            marked.set(true);
          }
          return item;
        });
    return marked.get();
  }

  Clock clock() {
    return clock;
  }

  private BufferItem<S> restoreOrCreate(MessageKey key) {
    Optional<PendingMessage<S>> pending = store.findPendingMessage(key);
    Map<String, String> labels =
        Map.of(
            BufferMetrics.LABEL_BRIDGE,
            String.valueOf(key.bridgeId()),
            BufferMetrics.LABEL_RESULT,
            pending.isPresent() ? "hit" : "miss");
    metrics.increment(BufferMetrics.RESTORE_TOTAL, labels, 1);

    if (pending.isPresent()) {
      log.debug("Restored {} from cold storage at version {}", key, pending.get().version());
      return BufferItem.restore(pending.get(), clock.instant());
    }
    return new BufferItem<>(stateFactory.get(), clock.instant());
  }
}
