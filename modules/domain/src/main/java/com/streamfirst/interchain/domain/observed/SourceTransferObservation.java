package com.streamfirst.interchain.domain.observed;

import com.streamfirst.interchain.domain.TransferType;
import java.math.BigInteger;
import java.util.Objects;

/** Token transfer initiated on the source chain alongside the message. */
public record SourceTransferObservation(
    TransferType type,
    String tokenAddress,
    String destinationTokenAddress,
    String sender,
    String recipient,
    BigInteger amount) {

  public SourceTransferObservation {
    Objects.requireNonNull(amount, "Transfer amount cannot be null");
  }
}
