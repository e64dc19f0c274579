package com.streamfirst.interchain.ports;

import com.streamfirst.interchain.domain.ConsolidatedMessage;
import java.util.Collection;

/** Final storage for consolidated messages and their transfers. */
public interface FinalStoragePort {

  /**
   * Inserts or updates the messages and their transfers. Messages are keyed by
   * {@code (id, bridgeId)}, transfers by {@code (bridgeId, messageId, index)}, so applying the
   * same input twice leaves storage unchanged.
   *
   * @param messages consolidated records, final or not
   * @throws StorageException if the write fails
   */
  void upsert(Collection<ConsolidatedMessage> messages);
}
