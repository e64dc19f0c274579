package com.streamfirst.interchain.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of a buffered message as moved to, or read back from, cold storage.
 *
 * @param key the message
 * @param state accumulated observations
 * @param touchedBlocks blocks that contributed to {@code state}
 * @param version modification counter at the time of the snapshot
 * @param lastFlushedVersion version last written to final storage
 * @param hotSince when the entry last entered the hot tier; informational once offloaded
 * @param <S> the buffered state type
 */
public record PendingMessage<S>(
    MessageKey key,
    S state,
    TouchedBlocks touchedBlocks,
    long version,
    long lastFlushedVersion,
    Instant hotSince) {

  public PendingMessage {
    Objects.requireNonNull(key, "Pending message key cannot be null");
    Objects.requireNonNull(state, "Pending message state cannot be null");
    touchedBlocks = touchedBlocks == null ? new TouchedBlocks() : touchedBlocks;
  }
}
