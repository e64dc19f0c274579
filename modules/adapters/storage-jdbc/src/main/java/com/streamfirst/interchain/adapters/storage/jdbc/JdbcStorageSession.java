package com.streamfirst.interchain.adapters.storage.jdbc;

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
import com.streamfirst.interchain.ports.PendingMessagePort;
import com.streamfirst.interchain.ports.StorageException;
import com.streamfirst.interchain.ports.StorageSession;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;

/** Storages bound to the connection of one {@link JdbcInterchainStore} transaction. */
@Slf4j
final class JdbcStorageSession<S extends Consolidatable<S>>
    implements StorageSession<S>, PendingMessagePort<S>, FinalStoragePort, CursorPort {

  // Every upsert is a single MERGE statement, understood by both H2 and PostgreSQL 15+.

  private static final String MERGE_PENDING =
      "MERGE INTO pending_messages AS t USING (SELECT CAST(? AS BIGINT) AS message_id,"
          + " CAST(? AS INTEGER) AS bridge_id, CAST(? AS VARCHAR) AS payload,"
          + " CAST(? AS TIMESTAMP) AS created_at) AS s"
          + " ON t.message_id = s.message_id AND t.bridge_id = s.bridge_id"
          + " WHEN MATCHED THEN UPDATE SET payload = s.payload, created_at = s.created_at"
          + " WHEN NOT MATCHED THEN INSERT (message_id, bridge_id, payload, created_at)"
          + " VALUES (s.message_id, s.bridge_id, s.payload, s.created_at)";
  private static final String DELETE_PENDING =
      "DELETE FROM pending_messages WHERE message_id = ? AND bridge_id = ?";

  // Source-side columns are immutable once a message is known.
  private static final String MERGE_MESSAGE =
      "MERGE INTO crosschain_messages AS t USING (SELECT CAST(? AS BIGINT) AS id,"
          + " CAST(? AS INTEGER) AS bridge_id, CAST(? AS VARCHAR) AS status,"
          + " CAST(? AS BIGINT) AS src_chain_id, CAST(? AS BIGINT) AS dst_chain_id,"
          + " CAST(? AS VARCHAR) AS native_id, CAST(? AS VARCHAR) AS src_tx_hash,"
          + " CAST(? AS VARCHAR) AS dst_tx_hash, CAST(? AS TIMESTAMP) AS init_timestamp,"
          + " CAST(? AS TIMESTAMP) AS last_update_timestamp, CAST(? AS VARCHAR) AS sender_address,"
          + " CAST(? AS VARCHAR) AS recipient_address, CAST(? AS VARCHAR) AS payload) AS s"
          + " ON t.id = s.id AND t.bridge_id = s.bridge_id"
          + " WHEN MATCHED THEN UPDATE SET status = s.status, dst_chain_id = s.dst_chain_id,"
          + " dst_tx_hash = s.dst_tx_hash, last_update_timestamp = s.last_update_timestamp,"
          + " sender_address = s.sender_address, recipient_address = s.recipient_address,"
          + " payload = s.payload, updated_at = CURRENT_TIMESTAMP"
          + " WHEN NOT MATCHED THEN INSERT (id, bridge_id, status, src_chain_id, dst_chain_id,"
          + " native_id, src_tx_hash, dst_tx_hash, init_timestamp, last_update_timestamp,"
          + " sender_address, recipient_address, payload) VALUES (s.id, s.bridge_id, s.status,"
          + " s.src_chain_id, s.dst_chain_id, s.native_id, s.src_tx_hash, s.dst_tx_hash,"
          + " s.init_timestamp, s.last_update_timestamp, s.sender_address, s.recipient_address,"
          + " s.payload)";

  private static final String MERGE_TRANSFER =
      "MERGE INTO crosschain_transfers AS t USING (SELECT CAST(? AS INTEGER) AS bridge_id,"
          + " CAST(? AS BIGINT) AS message_id, CAST(? AS INTEGER) AS transfer_index,"
          + " CAST(? AS VARCHAR) AS type, CAST(? AS BIGINT) AS token_src_chain_id,"
          + " CAST(? AS BIGINT) AS token_dst_chain_id, CAST(? AS NUMERIC(78, 0)) AS src_amount,"
          + " CAST(? AS NUMERIC(78, 0)) AS dst_amount, CAST(? AS VARCHAR) AS token_src_address,"
          + " CAST(? AS VARCHAR) AS token_dst_address, CAST(? AS VARCHAR) AS sender_address,"
          + " CAST(? AS VARCHAR) AS recipient_address) AS s"
          + " ON t.bridge_id = s.bridge_id AND t.message_id = s.message_id"
          + " AND t.transfer_index = s.transfer_index"
          + " WHEN MATCHED THEN UPDATE SET type = s.type, token_src_chain_id = s.token_src_chain_id,"
          + " token_dst_chain_id = s.token_dst_chain_id, src_amount = s.src_amount,"
          + " dst_amount = s.dst_amount, token_src_address = s.token_src_address,"
          + " token_dst_address = s.token_dst_address, sender_address = s.sender_address,"
          + " recipient_address = s.recipient_address, updated_at = CURRENT_TIMESTAMP"
          + " WHEN NOT MATCHED THEN INSERT (bridge_id, message_id, transfer_index, type,"
          + " token_src_chain_id, token_dst_chain_id, src_amount, dst_amount, token_src_address,"
          + " token_dst_address, sender_address, recipient_address) VALUES (s.bridge_id,"
          + " s.message_id, s.transfer_index, s.type, s.token_src_chain_id, s.token_dst_chain_id,"
          + " s.src_amount, s.dst_amount, s.token_src_address, s.token_dst_address,"
          + " s.sender_address, s.recipient_address)";

  private static final String SELECT_CURSOR =
      "SELECT catchup_max_cursor, realtime_cursor FROM indexer_checkpoints"
          + " WHERE bridge_id = ? AND chain_id = ?";
  private static final String MERGE_CURSOR =
      "MERGE INTO indexer_checkpoints AS t USING (SELECT CAST(? AS INTEGER) AS bridge_id,"
          + " CAST(? AS BIGINT) AS chain_id, CAST(? AS BIGINT) AS catchup_max_cursor,"
          + " CAST(? AS BIGINT) AS realtime_cursor) AS s"
          + " ON t.bridge_id = s.bridge_id AND t.chain_id = s.chain_id"
          + " WHEN MATCHED THEN UPDATE SET"
          + " catchup_max_cursor = LEAST(t.catchup_max_cursor, s.catchup_max_cursor),"
          + " realtime_cursor = GREATEST(t.realtime_cursor, s.realtime_cursor),"
          + " updated_at = CURRENT_TIMESTAMP"
          + " WHEN NOT MATCHED THEN INSERT (bridge_id, chain_id, catchup_min_cursor,"
          + " catchup_max_cursor, finality_cursor, realtime_cursor)"
          + " VALUES (s.bridge_id, s.chain_id, 0, s.catchup_max_cursor, 0, s.realtime_cursor)";

  private final Connection connection;
  private final PendingPayloadCodec<S> codec;
  private boolean closed;

  JdbcStorageSession(Connection connection, PendingPayloadCodec<S> codec) {
    this.connection = connection;
    this.codec = codec;
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

  void close() {
    closed = true;
  }

  @Override
  public void offload(Collection<PendingMessage<S>> messages) {
    ensureOpen();
    try (PreparedStatement merge = connection.prepareStatement(MERGE_PENDING)) {
      for (PendingMessage<S> pending : messages) {
        merge.setLong(1, pending.key().messageId());
        merge.setInt(2, pending.key().bridgeId());
        merge.setString(3, codec.encode(pending));
        setInstant(merge, 4, pending.hotSince());
        merge.addBatch();
      }
      merge.executeBatch();
      log.debug("Offloaded {} pending messages", messages.size());
    } catch (SQLException e) {
      throw new StorageException("Failed to offload pending messages", e);
    }
  }

  @Override
  public void deleteByKeys(Collection<MessageKey> keys) {
    ensureOpen();
    try (PreparedStatement delete = connection.prepareStatement(DELETE_PENDING)) {
      for (MessageKey key : keys) {
        delete.setLong(1, key.messageId());
        delete.setInt(2, key.bridgeId());
        delete.addBatch();
      }
      delete.executeBatch();
    } catch (SQLException e) {
      throw new StorageException("Failed to delete pending messages", e);
    }
  }

  @Override
  public void upsert(Collection<ConsolidatedMessage> messages) {
    ensureOpen();
    try {
      upsertMessages(messages);
      upsertTransfers(messages);
    } catch (SQLException e) {
      throw new StorageException("Failed to write consolidated messages", e);
    }
  }

  private void upsertMessages(Collection<ConsolidatedMessage> messages) throws SQLException {
    try (PreparedStatement merge = connection.prepareStatement(MERGE_MESSAGE)) {
      for (ConsolidatedMessage consolidated : messages) {
        CrosschainMessage message = consolidated.message();
        merge.setLong(1, message.getId());
        merge.setInt(2, message.getBridgeId());
        merge.setString(3, message.getStatus().name());
        merge.setLong(4, message.getSrcChainId());
        setLong(merge, 5, message.getDstChainId());
        merge.setString(6, message.getNativeId());
        merge.setString(7, message.getSrcTxHash());
        merge.setString(8, message.getDstTxHash());
        setInstant(merge, 9, message.getInitTimestamp());
        setInstant(merge, 10, message.getLastUpdateTimestamp());
        merge.setString(11, message.getSenderAddress());
        merge.setString(12, message.getRecipientAddress());
        merge.setString(13, message.getPayload());
        merge.addBatch();
      }
      merge.executeBatch();
    }
  }

  private void upsertTransfers(Collection<ConsolidatedMessage> messages) throws SQLException {
    try (PreparedStatement merge = connection.prepareStatement(MERGE_TRANSFER)) {
      for (ConsolidatedMessage consolidated : messages) {
        for (CrosschainTransfer transfer : consolidated.transfers()) {
          merge.setInt(1, transfer.getBridgeId());
          merge.setLong(2, transfer.getMessageId());
          merge.setInt(3, transfer.getIndex());
          merge.setString(4, transfer.getType() == null ? null : transfer.getType().name());
          merge.setLong(5, transfer.getTokenSrcChainId());
          merge.setLong(6, transfer.getTokenDstChainId());
          merge.setBigDecimal(7, new BigDecimal(transfer.getSrcAmount()));
          merge.setBigDecimal(8, new BigDecimal(transfer.getDstAmount()));
          merge.setString(9, transfer.getTokenSrcAddress());
          merge.setString(10, transfer.getTokenDstAddress());
          merge.setString(11, transfer.getSenderAddress());
          merge.setString(12, transfer.getRecipientAddress());
          merge.addBatch();
        }
      }
      merge.executeBatch();
    }
  }

  @Override
  public Map<CursorKey, Cursor> fetch(Collection<CursorKey> keys) {
    ensureOpen();
    Map<CursorKey, Cursor> found = new TreeMap<>();
    try (PreparedStatement select = connection.prepareStatement(SELECT_CURSOR)) {
      for (CursorKey key : keys) {
        select.setInt(1, key.bridgeId());
        select.setLong(2, key.chainId());
        try (ResultSet rs = select.executeQuery()) {
          if (rs.next()) {
            found.put(
                key,
                new Cursor(
                    Math.max(0L, rs.getLong("catchup_max_cursor")),
                    Math.max(0L, rs.getLong("realtime_cursor"))));
          }
        }
      }
      return found;
    } catch (SQLException e) {
      throw new StorageException("Failed to fetch cursors", e);
    }
  }

  @Override
  public void upsert(Map<CursorKey, Cursor> cursors) {
    ensureOpen();
    try (PreparedStatement merge = connection.prepareStatement(MERGE_CURSOR)) {
      for (Map.Entry<CursorKey, Cursor> entry : cursors.entrySet()) {
        merge.setInt(1, entry.getKey().bridgeId());
        merge.setLong(2, entry.getKey().chainId());
        merge.setLong(3, entry.getValue().backward());
        merge.setLong(4, entry.getValue().forward());
        merge.addBatch();
      }
      merge.executeBatch();
    } catch (SQLException e) {
      throw new StorageException("Failed to upsert cursors", e);
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new StorageException("Storage session used after its transaction ended");
    }
  }

  private static void setInstant(PreparedStatement statement, int index, Instant value)
      throws SQLException {
    if (value == null) {
      statement.setNull(index, Types.TIMESTAMP);
    } else {
      statement.setTimestamp(index, Timestamp.from(value));
    }
  }

  private static void setLong(PreparedStatement statement, int index, Long value)
      throws SQLException {
    if (value == null) {
      statement.setNull(index, Types.BIGINT);
    } else {
      statement.setLong(index, value);
    }
  }
}
