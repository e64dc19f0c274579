package com.streamfirst.interchain.application;

import com.streamfirst.interchain.domain.ConsolidatedMessage;

/**
 * Classification of one hot-tier entry during maintenance planning.
 *
 * @param kind what the consolidation attempt yielded
 * @param message the derived record for {@link Kind#PARTIAL} and {@link Kind#COMPLETE}, null
 *     otherwise
 */
record ConsolidationOutcome(Kind kind, ConsolidatedMessage message) {

  enum Kind {
    /** Not modified since the last consolidation attempt */
    UNCHANGED,
    /** Not enough observations to build a record yet */
    NOT_READY,
    /** A record exists but the message is not final */
    PARTIAL,
    /** The message reached its terminal state */
    COMPLETE
  }

  static final ConsolidationOutcome UNCHANGED = new ConsolidationOutcome(Kind.UNCHANGED, null);
  static final ConsolidationOutcome NOT_READY = new ConsolidationOutcome(Kind.NOT_READY, null);

  static ConsolidationOutcome of(ConsolidatedMessage message) {
    return new ConsolidationOutcome(message.isFinal() ? Kind.COMPLETE : Kind.PARTIAL, message);
  }
}
