package com.streamfirst.interchain.application;

/** Step of a maintenance cycle, reported with failures. */
public enum MaintenancePhase {
  SNAPSHOT("snapshot hot tier"),
  CONSOLIDATE("consolidate entry"),
  OFFLOAD("offload stale entries to pending storage"),
  FLUSH("flush consolidated messages to final storage"),
  DELETE_PENDING("delete finalized entries from pending storage"),
  FETCH_CURSORS("fetch cursors"),
  UPSERT_CURSORS("upsert cursors"),
  COMMIT("commit maintenance transaction");

  private final String description;

  MaintenancePhase(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
