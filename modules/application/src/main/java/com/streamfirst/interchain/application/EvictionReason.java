package com.streamfirst.interchain.application;

/** Why the maintenance cycle wants an entry out of the hot tier. */
public enum EvictionReason {
  /** Outlived the hot TTL without becoming final; moved to cold storage */
  STALE,
  /** Became final and was written to final storage */
  FINALIZED
}
