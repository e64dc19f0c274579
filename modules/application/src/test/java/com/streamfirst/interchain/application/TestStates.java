package com.streamfirst.interchain.application;

import java.util.function.Consumer;

/** Mutations steering {@link TestState} into a classification. */
final class TestStates {

  private TestStates() {}

  static Consumer<TestState> partial() {
    return s -> {
      s.observations++;
      s.ready = true;
    };
  }

  static Consumer<TestState> complete(int transfers) {
    return s -> {
      s.observations++;
      s.ready = true;
      s.complete = true;
      s.transfers = transfers;
    };
  }
}
