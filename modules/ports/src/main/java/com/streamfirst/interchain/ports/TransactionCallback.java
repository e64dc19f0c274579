package com.streamfirst.interchain.ports;

import com.streamfirst.interchain.domain.Consolidatable;

/**
 * Unit of work executed by {@link InterchainStorePort#inTransaction}.
 *
 * @param <S> the buffered message state type
 * @param <R> the result type
 */
@FunctionalInterface
public interface TransactionCallback<S extends Consolidatable<S>, R> {

  R doInTransaction(StorageSession<S> session);
}
