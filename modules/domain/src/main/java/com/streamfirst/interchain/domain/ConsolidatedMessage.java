package com.streamfirst.interchain.domain;

import java.util.List;
import java.util.Objects;

/**
 * Durable projection derived from the observations buffered for one message.
 *
 * @param isFinal whether the message reached its terminal state and can leave both tiers
 * @param message the primary message projection
 * @param transfers associated transfer records, possibly empty
 */
public record ConsolidatedMessage(
    boolean isFinal, CrosschainMessage message, List<CrosschainTransfer> transfers) {

  public ConsolidatedMessage {
    Objects.requireNonNull(message, "Consolidated message cannot be null");
    transfers = transfers == null ? List.of() : List.copyOf(transfers);
  }

  public static ConsolidatedMessage partial(
      CrosschainMessage message, List<CrosschainTransfer> transfers) {
    return new ConsolidatedMessage(false, message, transfers);
  }

  public static ConsolidatedMessage complete(
      CrosschainMessage message, List<CrosschainTransfer> transfers) {
    return new ConsolidatedMessage(true, message, transfers);
  }
}
