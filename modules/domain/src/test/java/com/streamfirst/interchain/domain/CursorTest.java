package com.streamfirst.interchain.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CursorTest {

  @Test
  void not_behind_keeps_widest_coverage() {
    var previous = new Cursor(100, 200);

    assertThat(new Cursor(120, 180).notBehind(previous)).isEqualTo(new Cursor(100, 200));
    assertThat(new Cursor(90, 250).notBehind(previous)).isEqualTo(new Cursor(90, 250));
    assertThat(new Cursor(90, 250).notBehind(null)).isEqualTo(new Cursor(90, 250));
  }

  @Test
  void keys_order_by_bridge_first() {
    assertThat(new MessageKey(1L, 2)).isGreaterThan(new MessageKey(5L, 1));
    assertThat(new CursorKey(1, 9L)).isLessThan(new CursorKey(2, 1L));
    assertThat(new MessageKey(5L, 1)).hasToString("1/5");
  }
}
