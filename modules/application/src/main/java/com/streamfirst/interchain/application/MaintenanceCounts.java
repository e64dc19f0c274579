package com.streamfirst.interchain.application;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Counters of one bridge for one maintenance cycle. */
@Getter
@ToString
@EqualsAndHashCode
public final class MaintenanceCounts {

  private long finalizedMessages;
  private long finalizedTransfers;
  private long hotEntries;
  private long notConsolidatable;
  private long stale;
  private long consolidatedNotFinal;
  private long removedStale;
  private long removedFinalized;
  private long skippedModified;

  void finalized(int transfers) {
    finalizedMessages++;
    finalizedTransfers += transfers;
  }

  void hotEntry() {
    hotEntries++;
  }

  void notConsolidatable() {
    notConsolidatable++;
  }

  void stale() {
    stale++;
  }

  void consolidatedNotFinal() {
    consolidatedNotFinal++;
  }

  void removed(EvictionReason reason) {
    switch (reason) {
      case STALE -> removedStale++;
      case FINALIZED -> removedFinalized++;
    }
  }

  /** Eviction lost a race with ingestion; the entry stays hot. */
  void skippedModified() {
    skippedModified++;
    hotEntries++;
  }

  MaintenanceCounts add(MaintenanceCounts other) {
    finalizedMessages += other.finalizedMessages;
    finalizedTransfers += other.finalizedTransfers;
    hotEntries += other.hotEntries;
    notConsolidatable += other.notConsolidatable;
    stale += other.stale;
    consolidatedNotFinal += other.consolidatedNotFinal;
    removedStale += other.removedStale;
    removedFinalized += other.removedFinalized;
    skippedModified += other.skippedModified;
    return this;
  }

  MaintenanceCounts copy() {
    return new MaintenanceCounts().add(this);
  }
}
