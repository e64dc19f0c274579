package com.streamfirst.interchain.ports;

/** Failure of a storage adapter. Usually transient; the operation can be retried. */
public class StorageException extends RuntimeException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
