package com.streamfirst.interchain.application;

import com.streamfirst.interchain.domain.Consolidatable;
import com.streamfirst.interchain.domain.MessageKey;
import com.streamfirst.interchain.domain.PendingMessage;
import com.streamfirst.interchain.domain.TouchedBlocks;
import java.time.Instant;
import lombok.Getter;

/**
 * Hot-tier entry: the accumulated state of one message plus the bookkeeping the maintenance
 * cycle needs. Not thread-safe; live instances are only touched under their key's lock in
 * {@link MessageBuffer}, and maintenance reads private {@link #snapshot() snapshots}.
 *
 * @param <S> the buffered state type
 */
@Getter
public final class BufferItem<S extends Consolidatable<S>> {

  private final S state;

  private final TouchedBlocks touchedBlocks;

  /** Bumped by every mutation; used to detect concurrent modification. */
  private long version;

  /** Last version written to final storage. */
  private long lastFlushedVersion;

  /** When the entry was created or last re-admitted from cold storage. */
  private final Instant hotSince;

  BufferItem(S state, Instant hotSince) {
    this(state, new TouchedBlocks(), 0L, 0L, hotSince);
  }

  private BufferItem(
      S state, TouchedBlocks touchedBlocks, long version, long lastFlushedVersion, Instant hotSince) {
    this.state = state;
    this.touchedBlocks = touchedBlocks;
    this.version = version;
    this.lastFlushedVersion = lastFlushedVersion;
    this.hotSince = hotSince;
  }

  /** Re-admits an offloaded entry, giving it a full TTL from {@code now}. */
  static <S extends Consolidatable<S>> BufferItem<S> restore(PendingMessage<S> pending, Instant now) {
    return new BufferItem<>(
        pending.state(),
        pending.touchedBlocks().copy(),
        pending.version(),
        pending.lastFlushedVersion(),
        now);
  }

  /** True if the entry changed since it was last written to final storage. */
  public boolean isDirty() {
    return version > lastFlushedVersion;
  }

  void recordBlock(long chainId, long blockNumber) {
    touchedBlocks.record(chainId, blockNumber);
  }

  void touch() {
    version++;
  }

  void markFlushed(long flushedVersion) {
    lastFlushedVersion = Math.max(lastFlushedVersion, flushedVersion);
  }

  /** Deep copy, independent of further mutation of this entry. */
  BufferItem<S> snapshot() {
    return new BufferItem<>(
        state.copy(), touchedBlocks.copy(), version, lastFlushedVersion, hotSince);
  }

  PendingMessage<S> toPending(MessageKey key) {
    return new PendingMessage<>(key, state, touchedBlocks, version, lastFlushedVersion, hotSince);
  }
}
