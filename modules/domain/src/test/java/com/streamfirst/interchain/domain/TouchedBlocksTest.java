package com.streamfirst.interchain.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TouchedBlocksTest {

  @Test
  void keeps_blocks_sorted_and_unique_per_chain() {
    var touched = new TouchedBlocks().record(2L, 30L).record(1L, 12L).record(1L, 10L).record(1L, 12L);

    assertThat(touched.chains()).containsExactly(1L, 2L);
    assertThat(touched.blocks(1L)).containsExactly(10L, 12L);
    assertThat(touched.blocks(3L)).isEmpty();
  }

  @Test
  void views_are_read_only_and_copies_are_deep() {
    var touched = TouchedBlocks.of(Map.of(1L, List.of(5L)));
    var copy = touched.copy();

    assertThatThrownBy(() -> touched.blocks(1L).add(6L)).isInstanceOf(UnsupportedOperationException.class);

    copy.record(1L, 6L);
    assertThat(touched.blocks(1L)).containsExactly(5L);
    assertThat(copy).isNotEqualTo(touched);
    assertThat(touched.copy()).isEqualTo(touched);
  }
}
