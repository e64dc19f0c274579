package com.streamfirst.interchain.domain;

import java.math.BigInteger;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Token transfer carried by a cross-chain message. Uniquely identified by
 * {@code (bridgeId, messageId, index)}.
 */
@Value
@Builder(toBuilder = true)
public class CrosschainTransfer {

  long messageId;

  int bridgeId;

  /** Position of the transfer within its message. */
  int index;

  TransferType type;

  long tokenSrcChainId;

  long tokenDstChainId;

  @NonNull BigInteger srcAmount;

  @NonNull BigInteger dstAmount;

  @NonNull String tokenSrcAddress;

  @NonNull String tokenDstAddress;

  String senderAddress;

  String recipientAddress;
}
