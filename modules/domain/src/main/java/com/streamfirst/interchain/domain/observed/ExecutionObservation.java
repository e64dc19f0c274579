package com.streamfirst.interchain.domain.observed;

import java.time.Instant;

/**
 * Outcome of executing the message on the destination chain. A failed execution can be
 * retried on chain, in which case a later observation replaces this one.
 */
public record ExecutionObservation(
    boolean succeeded, long chainId, String txHash, Instant blockTimestamp) {}
