package com.streamfirst.interchain.domain;

import java.util.Comparator;

/**
 * Identifies a cross-chain message within a specific bridge.
 * The caller decides how {@code messageId} is derived from chain-specific fields,
 * for example by folding a 32-byte native message id into its first 8 bytes.
 *
 * @param messageId bridge-scoped message identifier, never reused
 * @param bridgeId the bridge relaying the message
 */
public record MessageKey(long messageId, int bridgeId) implements Comparable<MessageKey> {

  private static final Comparator<MessageKey> ORDER =
      Comparator.comparingInt(MessageKey::bridgeId).thenComparingLong(MessageKey::messageId);

  public static MessageKey of(long messageId, int bridgeId) {
    return new MessageKey(messageId, bridgeId);
  }

  @Override
  public int compareTo(MessageKey other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return bridgeId + "/" + messageId;
  }
}
