package com.streamfirst.interchain.ports;

import com.streamfirst.interchain.domain.Consolidatable;

/**
 * Storages bound to one open transaction. Instances must not be used after the transaction
 * that produced them has ended.
 *
 * @param <S> the buffered message state type
 */
public interface StorageSession<S extends Consolidatable<S>> {

  PendingMessagePort<S> pendingMessages();

  FinalStoragePort finalStorage();

  CursorPort cursors();
}
