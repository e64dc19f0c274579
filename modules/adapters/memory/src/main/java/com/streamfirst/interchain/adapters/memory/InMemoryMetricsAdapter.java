package com.streamfirst.interchain.adapters.memory;

import com.streamfirst.interchain.ports.MetricsPort;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the current value of every metric in memory. Observations are folded into a running
 * {@link Summary} per series, so retained state grows with the number of series only.
 */
@Slf4j
public class InMemoryMetricsAdapter implements MetricsPort {

  private final Map<Series, AtomicLong> counters = new ConcurrentHashMap<>();
  private final Map<Series, Double> gauges = new ConcurrentHashMap<>();
  private final Map<Series, Summary> summaries = new ConcurrentHashMap<>();

  @Override
  public void increment(String name, Map<String, String> labels, long delta) {
    counters.computeIfAbsent(Series.of(name, labels), s -> new AtomicLong()).addAndGet(delta);
  }

  @Override
  public void gauge(String name, Map<String, String> labels, double value) {
    gauges.put(Series.of(name, labels), value);
  }

  @Override
  public void observe(String name, Map<String, String> labels, double value) {
    summaries.merge(Series.of(name, labels), Summary.of(value), Summary::add);
    log.trace("{}{} observed {}", name, labels, value);
  }

  public long counter(String name, Map<String, String> labels) {
    AtomicLong value = counters.get(Series.of(name, labels));
    return value == null ? 0L : value.get();
  }

  public long counter(String name) {
    return counter(name, Map.of());
  }

  /** Sum of a counter over all of its label combinations. */
  public long counterTotal(String name) {
    return counters.entrySet().stream()
        .filter(e -> e.getKey().name().equals(name))
        .mapToLong(e -> e.getValue().get())
        .sum();
  }

  public OptionalDouble gauge(String name, Map<String, String> labels) {
    Double value = gauges.get(Series.of(name, labels));
    return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
  }

  public Optional<Summary> summary(String name, Map<String, String> labels) {
    return Optional.ofNullable(summaries.get(Series.of(name, labels)));
  }

  public Optional<Summary> summary(String name) {
    return summary(name, Map.of());
  }

  /** Number of distinct series held, counters, gauges and summaries together. */
  public int seriesCount() {
    return counters.size() + gauges.size() + summaries.size();
  }

  public void reset() {
    counters.clear();
    gauges.clear();
    summaries.clear();
  }

  /** Aggregate of the values observed on one series. */
  public record Summary(long count, double sum, double max, double last) {
    static Summary of(double value) {
      return new Summary(1, value, value, value);
    }

    Summary add(Summary next) {
      return new Summary(count + next.count, sum + next.sum, Math.max(max, next.max), next.last);
    }

    public double mean() {
      return count == 0 ? 0.0 : sum / count;
    }
  }

  private record Series(String name, Map<String, String> labels) {
    static Series of(String name, Map<String, String> labels) {
      return new Series(name, new TreeMap<>(labels));
    }
  }
}
