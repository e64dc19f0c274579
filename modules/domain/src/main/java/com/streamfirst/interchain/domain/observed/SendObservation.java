package com.streamfirst.interchain.domain.observed;

import java.time.Instant;
import java.util.Objects;

/**
 * Source-side send event. Its block timestamp becomes the message's init timestamp, so a
 * message cannot be consolidated before this is seen.
 */
public record SendObservation(
    long chainId,
    String txHash,
    Instant blockTimestamp,
    long destinationChainId,
    String nativeId,
    String sender,
    String recipient,
    String payload) {

  public SendObservation {
    Objects.requireNonNull(blockTimestamp, "Send block timestamp cannot be null");
  }
}
