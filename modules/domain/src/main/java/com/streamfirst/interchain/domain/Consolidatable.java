package com.streamfirst.interchain.domain;

import java.util.Optional;

/**
 * Accumulated, bridge-specific observations of one message, as buffered in the hot tier.
 * Each bridge protocol supplies its own implementation; the buffer never looks inside.
 *
 * @param <S> the concrete state type
 */
public interface Consolidatable<S extends Consolidatable<S>> {

  /**
   * Derives the durable record for the message, if enough has been observed.
   *
   * @param key the message the observations belong to
   * @return empty when the message is not consolidatable yet (for example the source-side
   *     send has not been seen), otherwise the record and whether it is final
   * @throws ConsolidationException if the observations cannot be turned into a record
   */
  Optional<ConsolidatedMessage> consolidate(MessageKey key);

  /**
   * Returns an independent copy. Maintenance works on copies so that ingestion can keep
   * mutating the original concurrently.
   */
  S copy();
}
