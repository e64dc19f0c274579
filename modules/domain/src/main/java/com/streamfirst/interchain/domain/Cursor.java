package com.streamfirst.interchain.domain;

/**
 * Scan coverage of one {@link CursorKey}. Everything between {@code backward} and
 * {@code forward} (inclusive) has been indexed and consolidated.
 *
 * @param backward catchup boundary, only ever moves towards genesis
 * @param forward realtime boundary, only ever moves towards the chain head
 */
public record Cursor(long backward, long forward) {

  /**
   * Combines this freshly computed cursor with the previously persisted one so that
   * neither boundary regresses.
   */
  public Cursor notBehind(Cursor previous) {
    if (previous == null) {
      return this;
    }
    return new Cursor(Math.min(previous.backward, backward), Math.max(previous.forward, forward));
  }
}
