package com.streamfirst.interchain.domain.observed;

import java.math.BigInteger;

/** Token transfer delivered on the destination chain. */
public record DestinationTransferObservation(String recipient, BigInteger amount) {}
