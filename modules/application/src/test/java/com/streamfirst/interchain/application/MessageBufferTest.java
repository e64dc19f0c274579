package com.streamfirst.interchain.application;

import static org.assertj.core.api.Assertions.assertThat;

import com.streamfirst.interchain.adapters.memory.InMemoryInterchainStore;
import com.streamfirst.interchain.adapters.memory.InMemoryMetricsAdapter;
import com.streamfirst.interchain.domain.MessageKey;
import com.streamfirst.interchain.domain.PendingMessage;
import com.streamfirst.interchain.domain.TouchedBlocks;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MessageBufferTest {

  private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");
  private static final MessageKey KEY = new MessageKey(11L, 1);

  private MutableClock clock;
  private InMemoryInterchainStore<TestState> store;
  private InMemoryMetricsAdapter metrics;
  private MessageBuffer<TestState> buffer;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    store = new InMemoryInterchainStore<>();
    metrics = new InMemoryMetricsAdapter();
    buffer = new MessageBuffer<>(TestState::create, store, metrics, clock);
  }

  @AfterEach
  void tearDown() {
    if (executor != null) {
      executor.shutdownNow();
    }
  }

  @Test
  void alter_creates_entry_and_records_block() {
    buffer.alter(KEY, 1L, 100L, s -> s.observations++);
    buffer.alter(KEY, 2L, 7L, s -> s.observations++);

    var item = buffer.snapshotOf(KEY).orElseThrow();
    assertThat(item.getVersion()).isEqualTo(2);
    assertThat(item.getState().observations).isEqualTo(2);
    assertThat(item.getTouchedBlocks().blocks(1L)).containsExactly(100L);
    assertThat(item.getTouchedBlocks().blocks(2L)).containsExactly(7L);
    assertThat(item.getHotSince()).isEqualTo(T0);
    assertThat(item.isDirty()).isTrue();
    assertThat(buffer.hotSize()).isEqualTo(1);
    assertThat(metrics.counter(BufferMetrics.RESTORE_TOTAL, Map.of("bridge", "1", "result", "miss"))).isEqualTo(1);
  }

  @Test
  void alter_restores_offloaded_entry_with_fresh_ttl() {
    var offloaded = TestState.create();
    offloaded.observations = 4;
    store.putPending(new PendingMessage<>(KEY, offloaded, new TouchedBlocks().record(1L, 90L), 4, 4, T0));
    clock.advance(Duration.ofMinutes(5));

    buffer.alter(KEY, 1L, 95L, s -> s.observations++);

    var item = buffer.snapshotOf(KEY).orElseThrow();
    assertThat(item.getState().observations).isEqualTo(5);
    assertThat(item.getVersion()).isEqualTo(5);
    assertThat(item.getLastFlushedVersion()).isEqualTo(4);
    assertThat(item.getTouchedBlocks().blocks(1L)).containsExactly(90L, 95L);
    assertThat(item.getHotSince()).isEqualTo(T0.plus(Duration.ofMinutes(5)));
    assertThat(metrics.counter(BufferMetrics.RESTORE_TOTAL, Map.of("bridge", "1", "result", "hit"))).isEqualTo(1);
  }

  @Test
  void cold_storage_is_only_consulted_for_absent_keys() {
    buffer.alter(KEY, 1L, 100L, s -> {});
    buffer.alter(KEY, 1L, 101L, s -> {});

    assertThat(metrics.counterTotal(BufferMetrics.RESTORE_TOTAL)).isEqualTo(1);
  }

  @Test
  void removal_requires_unchanged_version() {
    buffer.alter(KEY, 1L, 100L, s -> {});
    buffer.alter(KEY, 1L, 101L, s -> {});

    assertThat(buffer.removeIfVersion(KEY, 1)).isFalse();
    assertThat(buffer.hotSize()).isEqualTo(1);
    assertThat(buffer.removeIfVersion(KEY, 2)).isTrue();
    assertThat(buffer.hotSize()).isZero();
    assertThat(buffer.removeIfVersion(KEY, 2)).isFalse();
  }

  @Test
  void flush_marker_requires_unchanged_version() {
    buffer.alter(KEY, 1L, 100L, s -> {});
    buffer.alter(KEY, 1L, 101L, s -> {});

    assertThat(buffer.markFlushed(KEY, 1)).isFalse();
    assertThat(buffer.snapshotOf(KEY).orElseThrow().isDirty()).isTrue();

    assertThat(buffer.markFlushed(KEY, 2)).isTrue();
    assertThat(buffer.snapshotOf(KEY).orElseThrow().isDirty()).isFalse();
    assertThat(buffer.markFlushed(new MessageKey(99L, 1), 1)).isFalse();
  }

  @Test
  void snapshot_copies_are_not_affected_by_later_writes() {
    buffer.alter(KEY, 1L, 100L, s -> s.observations = 1);

    var snapshot = buffer.snapshot();
    buffer.alter(KEY, 1L, 101L, s -> s.observations = 2);

    assertThat(snapshot.get(KEY).getState().observations).isEqualTo(1);
    assertThat(snapshot.get(KEY).getVersion()).isEqualTo(1);
  }

  @Test
  void concurrent_alters_on_one_key_are_serialized() throws Exception {
    executor = Executors.newFixedThreadPool(8);
    List<Callable<Void>> tasks = new ArrayList<>();
    for (int t = 0; t < 32; t++) {
      long block = t;
      tasks.add(() -> {
        for (int i = 0; i < 100; i++) {
          buffer.alter(KEY, 1L, block, s -> s.observations++);
        }
        return null;
      });
    }

    for (Future<Void> future : executor.invokeAll(tasks)) {
      future.get();
    }

    var item = buffer.snapshotOf(KEY).orElseThrow();
    assertThat(item.getVersion()).isEqualTo(3200);
    assertThat(item.getState().observations).isEqualTo(3200);
    assertThat(item.getTouchedBlocks().blocks(1L)).hasSize(32);
  }
}
