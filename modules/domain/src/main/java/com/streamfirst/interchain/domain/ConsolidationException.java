package com.streamfirst.interchain.domain;

/** Raised when buffered observations for a message cannot be consolidated. */
public class ConsolidationException extends RuntimeException {

  private final MessageKey key;

  public ConsolidationException(MessageKey key, String message) {
    super("Cannot consolidate message " + key + ": " + message);
    this.key = key;
  }

  public ConsolidationException(MessageKey key, String message, Throwable cause) {
    super("Cannot consolidate message " + key + ": " + message, cause);
    this.key = key;
  }

  public MessageKey getKey() {
    return key;
  }
}
