package com.streamfirst.interchain.adapters.memory;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class InMemoryMetricsAdapterTest {

  private final InMemoryMetricsAdapter metrics = new InMemoryMetricsAdapter();

  @Test
  void counters_accumulate_per_label_set() {
    metrics.increment("restores", Map.of("bridge", "1", "result", "hit"), 2);
    metrics.increment("restores", Map.of("result", "hit", "bridge", "1"), 3);
    metrics.increment("restores", Map.of("bridge", "2", "result", "miss"), 1);

    assertThat(metrics.counter("restores", Map.of("bridge", "1", "result", "hit"))).isEqualTo(5);
    assertThat(metrics.counterTotal("restores")).isEqualTo(6);
    assertThat(metrics.counter("unknown")).isZero();
  }

  @Test
  void gauge_keeps_last_value() {
    metrics.gauge("hot", Map.of("bridge", "1"), 4);
    metrics.gauge("hot", Map.of("bridge", "1"), 2);

    assertThat(metrics.gauge("hot", Map.of("bridge", "1"))).hasValue(2.0);
    assertThat(metrics.gauge("hot", Map.of("bridge", "9"))).isEmpty();
  }

  @Test
  void observations_are_summarized_until_reset() {
    metrics.observe("duration", 0.5);
    metrics.observe("duration", 0.25);

    assertThat(metrics.summary("duration"))
        .hasValueSatisfying(
            s -> {
              assertThat(s.count()).isEqualTo(2);
              assertThat(s.sum()).isEqualTo(0.75);
              assertThat(s.max()).isEqualTo(0.5);
              assertThat(s.last()).isEqualTo(0.25);
              assertThat(s.mean()).isEqualTo(0.375);
            });

    metrics.reset();
    assertThat(metrics.summary("duration")).isEmpty();
    assertThat(metrics.seriesCount()).isZero();
  }

  @Test
  void repeated_observations_do_not_grow_retained_series() {
    var labels = Map.of("bridge", "1", "reason", "stale");
    metrics.observe("evicted", labels, 1);
    int series = metrics.seriesCount();

    for (int i = 0; i < 10_000; i++) {
      metrics.observe("evicted", labels, 1);
      metrics.gauge("hot", Map.of("bridge", "1"), i);
    }

    assertThat(metrics.seriesCount()).isEqualTo(series + 1);
    assertThat(metrics.summary("evicted", labels)).hasValueSatisfying(s -> assertThat(s.count()).isEqualTo(10_001));
  }
}
