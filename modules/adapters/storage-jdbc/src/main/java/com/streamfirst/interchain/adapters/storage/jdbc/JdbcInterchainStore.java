package com.streamfirst.interchain.adapters.storage.jdbc;

import com.streamfirst.interchain.domain.Consolidatable;
import com.streamfirst.interchain.domain.MessageKey;
import com.streamfirst.interchain.domain.PendingMessage;
import com.streamfirst.interchain.ports.InterchainStorePort;
import com.streamfirst.interchain.ports.StorageException;
import com.streamfirst.interchain.ports.TransactionCallback;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Optional;
import javax.sql.DataSource;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link InterchainStorePort} over a JDBC {@link DataSource}. Each transaction borrows one
 * connection with auto-commit off; see {@link InterchainSchema} for the tables.
 *
 * @param <S> the buffered state type
 */
@Slf4j
public class JdbcInterchainStore<S extends Consolidatable<S>> implements InterchainStorePort<S> {

  private static final String FIND_PENDING =
      "SELECT payload, created_at FROM pending_messages WHERE message_id = ? AND bridge_id = ?";

  private final DataSource dataSource;
  private final PendingPayloadCodec<S> codec;

  public JdbcInterchainStore(@NonNull DataSource dataSource, @NonNull PendingPayloadCodec<S> codec) {
    this.dataSource = dataSource;
    this.codec = codec;
  }

  @Override
  public <R> R inTransaction(TransactionCallback<S, R> callback) {
    Connection connection = open();
    JdbcStorageSession<S> session = new JdbcStorageSession<>(connection, codec);
    try {
      R result = callback.doInTransaction(session);
      commit(connection);
      return result;
    } catch (RuntimeException e) {
      rollback(connection, e);
      throw e;
    } finally {
      session.close();
      release(connection);
    }
  }

  @Override
  public Optional<PendingMessage<S>> findPendingMessage(MessageKey key) {
    try (Connection connection = dataSource.getConnection();
        PreparedStatement statement = connection.prepareStatement(FIND_PENDING)) {
      statement.setLong(1, key.messageId());
      statement.setInt(2, key.bridgeId());
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        Timestamp createdAt = rs.getTimestamp("created_at");
        return Optional.of(
            codec.decode(key, rs.getString("payload"), createdAt == null ? null : createdAt.toInstant()));
      }
    } catch (SQLException e) {
      throw new StorageException("Failed to look up pending message " + key, e);
    }
  }

  private Connection open() {
    try {
      Connection connection = dataSource.getConnection();
      connection.setAutoCommit(false);
      return connection;
    } catch (SQLException e) {
      throw new StorageException("Failed to open transaction", e);
    }
  }

  private static void commit(Connection connection) {
    try {
      connection.commit();
    } catch (SQLException e) {
      throw new StorageException("Failed to commit transaction", e);
    }
  }

  private static void rollback(Connection connection, RuntimeException cause) {
    try {
      connection.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
      log.warn("Rollback failed after {}", cause.getMessage(), e);
    }
  }

  private static void release(Connection connection) {
    try {
      connection.setAutoCommit(true);
      connection.close();
    } catch (SQLException e) {
      log.warn("Failed to release connection", e);
    }
  }
}
