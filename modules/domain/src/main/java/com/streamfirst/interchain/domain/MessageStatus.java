package com.streamfirst.interchain.domain;

/** Lifecycle status of a consolidated cross-chain message. */
public enum MessageStatus {
  /** Sent on the source chain, not yet executed on the destination */
  INITIATED,
  /** Executed successfully on the destination chain */
  COMPLETED,
  /** Execution was attempted and failed; may still be retried on chain */
  FAILED
}
