package com.streamfirst.interchain.domain.observed;

import java.time.Instant;

/** Destination-side receipt of the message. */
public record ReceiveObservation(long chainId, String txHash, Instant blockTimestamp) {}
