package com.streamfirst.interchain.ports;

import com.streamfirst.interchain.domain.Consolidatable;
import com.streamfirst.interchain.domain.MessageKey;
import com.streamfirst.interchain.domain.PendingMessage;
import java.util.Collection;

/**
 * Cold tier: durable overflow for buffered messages evicted from memory before they
 * became final.
 *
 * @param <S> the buffered message state type
 */
public interface PendingMessagePort<S extends Consolidatable<S>> {

  /**
   * Stores or replaces the given snapshots, keyed by message.
   *
   * @param messages snapshots to offload
   * @throws StorageException if the write fails
   */
  void offload(Collection<PendingMessage<S>> messages);

  /**
   * Removes pending rows for the given messages. Missing keys are ignored.
   *
   * @param keys messages that no longer need cold staging
   * @throws StorageException if the delete fails
   */
  void deleteByKeys(Collection<MessageKey> keys);
}
