package com.streamfirst.interchain.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.streamfirst.interchain.adapters.memory.InMemoryInterchainStore;
import com.streamfirst.interchain.adapters.memory.InMemoryMetricsAdapter;
import com.streamfirst.interchain.domain.MessageKey;
import java.time.Clock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MaintenanceSchedulerTest {

  private InMemoryInterchainStore<TestState> store;
  private InterferingStore<TestState> interfering;
  private InMemoryMetricsAdapter metrics;
  private MessageBuffer<TestState> buffer;
  private BufferMaintenance<TestState> maintenance;

  @BeforeEach
  void setUp() {
    store = new InMemoryInterchainStore<>();
    interfering = new InterferingStore<>(store);
    metrics = new InMemoryMetricsAdapter();
    buffer = new MessageBuffer<>(TestState::create, interfering, metrics, Clock.systemUTC());
    maintenance = new BufferMaintenance<>(buffer, interfering, BufferSettings.defaults(), metrics);
  }

  @Test
  void loop_drains_finalized_entries() throws InterruptedException {
    var key = new MessageKey(1L, 1);
    buffer.alter(key, 1L, 10L, TestStates.complete(0));

    try (var scheduler = new MaintenanceScheduler(maintenance, Duration.ofMillis(20))) {
      scheduler.start();
      assertThat(scheduler.isRunning()).isTrue();

      long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
      while (buffer.hotSize() > 0 && System.nanoTime() < deadline) {
        Thread.sleep(10);
      }
    }

    assertThat(buffer.hotSize()).isZero();
    assertThat(store.message(key)).isPresent();
  }

  @Test
  void failed_cycle_is_counted_and_not_rethrown() {
    buffer.alter(new MessageKey(1L, 1), 1L, 10L, TestStates.complete(0));
    interfering.failFlush(true);
    var scheduler = new MaintenanceScheduler(maintenance, Duration.ofSeconds(1));

    scheduler.runOnce();
    scheduler.runOnce();
    scheduler.close();

    assertThat(metrics.counter(BufferMetrics.MAINTENANCE_ERRORS_TOTAL)).isEqualTo(2);
    assertThat(buffer.hotSize()).isEqualTo(1);
  }

  @Test
  void cannot_start_twice() {
    try (var scheduler = new MaintenanceScheduler(maintenance, Duration.ofSeconds(1))) {
      scheduler.start();

      assertThatThrownBy(scheduler::start).isInstanceOf(IllegalStateException.class);
    }
  }

  @Test
  void close_stops_the_loop() {
    var scheduler = new MaintenanceScheduler(maintenance, Duration.ofMillis(50));
    scheduler.start();

    scheduler.close();

    assertThat(scheduler.isRunning()).isFalse();
  }
}
