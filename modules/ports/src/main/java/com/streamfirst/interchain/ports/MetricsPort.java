package com.streamfirst.interchain.ports;

import java.util.Map;

/** Sink for counters, gauges and observations. Exporting them is left to implementations. */
public interface MetricsPort {

  void increment(String name, Map<String, String> labels, long delta);

  void gauge(String name, Map<String, String> labels, double value);

  void observe(String name, Map<String, String> labels, double value);

  default void increment(String name, long delta) {
    increment(name, Map.of(), delta);
  }

  default void observe(String name, double value) {
    observe(name, Map.of(), value);
  }

  /** A sink that drops everything. */
  static MetricsPort noop() {
    return new MetricsPort() {
      @Override
      public void increment(String name, Map<String, String> labels, long delta) {}

      @Override
      public void gauge(String name, Map<String, String> labels, double value) {}

      @Override
      public void observe(String name, Map<String, String> labels, double value) {}
    };
  }
}
