package com.streamfirst.interchain.adapters.storage.jdbc;

import com.streamfirst.interchain.ports.StorageException;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;

/**
 * Tables used by {@link JdbcInterchainStore}. The DDL sticks to types and functions that
 * PostgreSQL and H2 share.
 */
@Slf4j
public final class InterchainSchema {

  public static final String PENDING_MESSAGES = "pending_messages";
  public static final String CROSSCHAIN_MESSAGES = "crosschain_messages";
  public static final String CROSSCHAIN_TRANSFERS = "crosschain_transfers";
  public static final String INDEXER_CHECKPOINTS = "indexer_checkpoints";

  static final List<String> DDL =
      List.of(
          "CREATE TABLE IF NOT EXISTS " + PENDING_MESSAGES + " ("
              + " message_id BIGINT NOT NULL,"
              + " bridge_id INTEGER NOT NULL,"
              + " payload VARCHAR NOT NULL,"
              + " created_at TIMESTAMP,"
              + " PRIMARY KEY (message_id, bridge_id))",
          "CREATE TABLE IF NOT EXISTS " + CROSSCHAIN_MESSAGES + " ("
              + " id BIGINT NOT NULL,"
              + " bridge_id INTEGER NOT NULL,"
              + " status VARCHAR(16) NOT NULL,"
              + " src_chain_id BIGINT NOT NULL,"
              + " dst_chain_id BIGINT,"
              + " native_id VARCHAR,"
              + " src_tx_hash VARCHAR,"
              + " dst_tx_hash VARCHAR,"
              + " init_timestamp TIMESTAMP NOT NULL,"
              + " last_update_timestamp TIMESTAMP,"
              + " sender_address VARCHAR,"
              + " recipient_address VARCHAR,"
              + " payload VARCHAR,"
              + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
              + " updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
              + " PRIMARY KEY (id, bridge_id))",
          "CREATE TABLE IF NOT EXISTS " + CROSSCHAIN_TRANSFERS + " ("
              + " message_id BIGINT NOT NULL,"
              + " bridge_id INTEGER NOT NULL,"
              + " transfer_index INTEGER NOT NULL,"
              + " type VARCHAR(16),"
              + " token_src_chain_id BIGINT NOT NULL,"
              + " token_dst_chain_id BIGINT NOT NULL,"
              + " src_amount NUMERIC(78, 0) NOT NULL,"
              + " dst_amount NUMERIC(78, 0) NOT NULL,"
              + " token_src_address VARCHAR NOT NULL,"
              + " token_dst_address VARCHAR NOT NULL,"
              + " sender_address VARCHAR,"
              + " recipient_address VARCHAR,"
              + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
              + " updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
              + " PRIMARY KEY (bridge_id, message_id, transfer_index))",
          "CREATE TABLE IF NOT EXISTS " + INDEXER_CHECKPOINTS + " ("
              + " bridge_id INTEGER NOT NULL,"
              + " chain_id BIGINT NOT NULL,"
              + " catchup_min_cursor BIGINT NOT NULL DEFAULT 0,"
              + " catchup_max_cursor BIGINT NOT NULL,"
              + " finality_cursor BIGINT NOT NULL DEFAULT 0,"
              + " realtime_cursor BIGINT NOT NULL,"
              + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
              + " updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
              + " PRIMARY KEY (bridge_id, chain_id))");

  private InterchainSchema() {}

  /**
   * Creates missing tables.
   *
   * @throws StorageException on any SQL error
   */
  public static void createSchema(DataSource dataSource) {
    try (Connection connection = dataSource.getConnection();
        Statement statement = connection.createStatement()) {
      for (String ddl : DDL) {
        statement.execute(ddl);
      }
      log.info("Interchain schema ready");
    } catch (SQLException e) {
      throw new StorageException("Failed to create interchain schema", e);
    }
  }
}
