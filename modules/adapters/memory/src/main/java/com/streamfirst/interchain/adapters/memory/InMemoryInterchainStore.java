package com.streamfirst.interchain.adapters.memory;

import com.streamfirst.interchain.domain.Consolidatable;
import com.streamfirst.interchain.domain.ConsolidatedMessage;
import com.streamfirst.interchain.domain.CrosschainMessage;
import com.streamfirst.interchain.domain.CrosschainTransfer;
import com.streamfirst.interchain.domain.Cursor;
import com.streamfirst.interchain.domain.CursorKey;
import com.streamfirst.interchain.domain.MessageKey;
import com.streamfirst.interchain.domain.PendingMessage;
import com.streamfirst.interchain.ports.CursorPort;
import com.streamfirst.interchain.ports.FinalStoragePort;
import com.streamfirst.interchain.ports.InterchainStorePort;
import com.streamfirst.interchain.ports.PendingMessagePort;
import com.streamfirst.interchain.ports.StorageException;
import com.streamfirst.interchain.ports.StorageSession;
import com.streamfirst.interchain.ports.TransactionCallback;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory implementation of {@link InterchainStorePort} for tests and local runs.
 *
 * <p>Transactions run one at a time against a private copy of the committed data, which
 * replaces the committed data only when the callback returns normally. Buffered state is
 * copied on the way in and out so callers never share instances with the store.
 * Data is lost when the process stops.
 */
@Slf4j
public class InMemoryInterchainStore<S extends Consolidatable<S>> implements InterchainStorePort<S> {

  private Tables<S> committed = new Tables<>();
  private boolean inTransaction;

  @Override
  public synchronized <R> R inTransaction(TransactionCallback<S, R> callback) {
    if (inTransaction) {
      throw new StorageException("Nested transactions are not supported");
    }
    Tables<S> working = committed.copy();
    Session session = new Session(working);
    inTransaction = true;
    try {
      R result = callback.doInTransaction(session);
      committed = working;
      log.debug("Committed transaction: {}", working);
      return result;
    } catch (RuntimeException e) {
      log.debug("Rolled back transaction: {}", e.getMessage());
      throw e;
    } finally {
      session.closed = true;
      inTransaction = false;
    }
  }

  @Override
  public synchronized Optional<PendingMessage<S>> findPendingMessage(MessageKey key) {
    return Optional.ofNullable(committed.pending.get(key)).map(InMemoryInterchainStore::copyOf);
  }

  public synchronized Map<MessageKey, PendingMessage<S>> pendingMessages() {
    Map<MessageKey, PendingMessage<S>> copy = new TreeMap<>();
    committed.pending.forEach((key, pending) -> copy.put(key, copyOf(pending)));
    return copy;
  }

  public synchronized Optional<CrosschainMessage> message(MessageKey key) {
    return Optional.ofNullable(committed.messages.get(key));
  }

  public synchronized Map<MessageKey, CrosschainMessage> messages() {
    return new TreeMap<>(committed.messages);
  }

  /** Transfers of a message, ordered by index. */
  public synchronized List<CrosschainTransfer> transfers(MessageKey key) {
    return committed.transfers.entrySet().stream()
        .filter(e -> e.getKey().bridgeId() == key.bridgeId() && e.getKey().messageId() == key.messageId())
        .map(Map.Entry::getValue)
        .sorted((a, b) -> Integer.compare(a.getIndex(), b.getIndex()))
        .collect(Collectors.toList());
  }

  public synchronized int transferCount() {
    return committed.transfers.size();
  }

  public synchronized Optional<Cursor> cursor(CursorKey key) {
    return Optional.ofNullable(committed.cursors.get(key));
  }

  public synchronized Map<CursorKey, Cursor> cursors() {
    return new TreeMap<>(committed.cursors);
  }

  /** Seeds a cursor directly, bypassing the monotonic merge. */
  public synchronized void putCursor(CursorKey key, Cursor cursor) {
    committed.cursors.put(key, cursor);
  }

  /** Seeds a cold entry directly. */
  public synchronized void putPending(PendingMessage<S> pending) {
    committed.pending.put(pending.key(), copyOf(pending));
  }

  private static <S extends Consolidatable<S>> PendingMessage<S> copyOf(PendingMessage<S> pending) {
    return new PendingMessage<>(
        pending.key(),
        pending.state().copy(),
        pending.touchedBlocks().copy(),
        pending.version(),
        pending.lastFlushedVersion(),
        pending.hotSince());
  }

  private record TransferKey(int bridgeId, long messageId, int index) {}

  private static final class Tables<S extends Consolidatable<S>> {
    final Map<MessageKey, PendingMessage<S>> pending = new HashMap<>();
    final Map<MessageKey, CrosschainMessage> messages = new HashMap<>();
    final Map<TransferKey, CrosschainTransfer> transfers = new HashMap<>();
    final Map<CursorKey, Cursor> cursors = new HashMap<>();

    // Stored values are immutable or already private copies, so a shallow copy isolates.
    Tables<S> copy() {
      Tables<S> copy = new Tables<>();
      copy.pending.putAll(pending);
      copy.messages.putAll(messages);
      copy.transfers.putAll(transfers);
      copy.cursors.putAll(cursors);
      return copy;
    }

    @Override
    public String toString() {
      return "pending="
          + pending.size()
          + " messages="
          + messages.size()
          + " transfers="
          + transfers.size()
          + " cursors="
          + cursors.size();
    }
  }

  private final class Session
      implements StorageSession<S>, PendingMessagePort<S>, FinalStoragePort, CursorPort {

    private final Tables<S> tables;
    private boolean closed;

    Session(Tables<S> tables) {
      this.tables = tables;
    }

    @Override
    public PendingMessagePort<S> pendingMessages() {
      return this;
    }

    @Override
    public FinalStoragePort finalStorage() {
      return this;
    }

    @Override
    public CursorPort cursors() {
      return this;
    }

    @Override
    public void offload(Collection<PendingMessage<S>> messages) {
      ensureOpen();
      messages.forEach(pending -> tables.pending.put(pending.key(), copyOf(pending)));
    }

    @Override
    public void deleteByKeys(Collection<MessageKey> keys) {
      ensureOpen();
      keys.forEach(tables.pending::remove);
    }

    @Override
    public void upsert(Collection<ConsolidatedMessage> messages) {
      ensureOpen();
      for (ConsolidatedMessage consolidated : messages) {
        CrosschainMessage message = consolidated.message();
        tables.messages.put(message.key(), message);
      }
      for (ConsolidatedMessage consolidated : messages) {
        for (CrosschainTransfer transfer : consolidated.transfers()) {
          tables.transfers.put(
              new TransferKey(transfer.getBridgeId(), transfer.getMessageId(), transfer.getIndex()),
              transfer);
        }
      }
    }

    @Override
    public Map<CursorKey, Cursor> fetch(Collection<CursorKey> keys) {
      ensureOpen();
      Map<CursorKey, Cursor> found = new TreeMap<>();
      for (CursorKey key : keys) {
        Cursor cursor = tables.cursors.get(key);
        if (cursor != null) {
          found.put(key, cursor);
        }
      }
      return found;
    }

    @Override
    public void upsert(Map<CursorKey, Cursor> cursors) {
      ensureOpen();
      cursors.forEach(
          (key, cursor) ->
              tables.cursors.merge(
                  key,
                  cursor,
                  (old, fresh) ->
                      new Cursor(
                          Math.min(old.backward(), fresh.backward()),
                          Math.max(old.forward(), fresh.forward()))));
    }

    private void ensureOpen() {
      if (closed) {
        throw new StorageException("Storage session used after its transaction ended");
      }
    }
  }
}
