package com.streamfirst.interchain.domain;

import java.time.Instant;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Primary projection of a cross-chain message as written to final storage.
 * Uniquely identified by {@code (id, bridgeId)}; re-writing the same projection is idempotent.
 */
@Value
@Builder(toBuilder = true)
public class CrosschainMessage {

  long id;

  int bridgeId;

  @NonNull MessageStatus status;

  /** Blockchain time the message appeared on the source chain, not indexing time. */
  @NonNull Instant initTimestamp;

  /** Blockchain time of the latest destination-side observation, if any. */
  Instant lastUpdateTimestamp;

  long srcChainId;

  Long dstChainId;

  String nativeId;

  String srcTxHash;

  String dstTxHash;

  String senderAddress;

  String recipientAddress;

  /** Hex-encoded raw message payload, bridge-specific. */
  String payload;

  public MessageKey key() {
    return new MessageKey(id, bridgeId);
  }
}
