package com.streamfirst.interchain.ports;

import com.streamfirst.interchain.domain.Consolidatable;
import com.streamfirst.interchain.domain.MessageKey;
import com.streamfirst.interchain.domain.PendingMessage;
import java.util.Optional;

/**
 * Durable side of the message buffer. Groups the pending (cold), final and cursor storages
 * behind one transactional boundary so that a maintenance cycle is applied all-or-nothing.
 *
 * @param <S> the buffered message state type
 */
public interface InterchainStorePort<S extends Consolidatable<S>> {

  /**
   * Runs the callback inside a single storage transaction. The transaction commits when the
   * callback returns normally and rolls back when it throws; in the latter case the exception
   * is rethrown unchanged.
   *
   * @param callback the work to run against the transactional session
   * @return whatever the callback returned
   * @throws StorageException if the transaction cannot be opened or committed
   */
  <R> R inTransaction(TransactionCallback<S, R> callback);

  /**
   * Looks up an offloaded message outside of any maintenance transaction.
   * Used to re-admit cold entries into the hot tier when new observations arrive.
   *
   * @param key the message
   * @return the pending snapshot if the message sits in cold storage
   * @throws StorageException if the lookup fails
   */
  Optional<PendingMessage<S>> findPendingMessage(MessageKey key);
}
