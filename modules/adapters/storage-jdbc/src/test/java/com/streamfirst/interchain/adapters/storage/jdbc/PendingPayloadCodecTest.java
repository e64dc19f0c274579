package com.streamfirst.interchain.adapters.storage.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.streamfirst.interchain.domain.MessageKey;
import com.streamfirst.interchain.domain.PendingMessage;
import com.streamfirst.interchain.domain.TouchedBlocks;
import com.streamfirst.interchain.domain.TransferType;
import com.streamfirst.interchain.domain.observed.ExecutionObservation;
import com.streamfirst.interchain.domain.observed.ObservedMessage;
import com.streamfirst.interchain.domain.observed.SendObservation;
import com.streamfirst.interchain.domain.observed.SourceTransferObservation;
import com.streamfirst.interchain.ports.StorageException;
import java.math.BigInteger;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class PendingPayloadCodecTest {

  private static final MessageKey KEY = new MessageKey(1L, 2);
  private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

  private final PendingPayloadCodec<ObservedMessage> codec = new PendingPayloadCodec<>(ObservedMessage.class);

  @Test
  void state_survives_the_json_form() {
    var state = new ObservedMessage();
    state.setSend(new SendObservation(1L, "0xsrc", T0, 2L, null, "0xa", "0xb", "0x"));
    state.setExecution(new ExecutionObservation(false, 2L, "0xdst", T0.plusSeconds(60)));
    state.setTransferExpected(true);
    state.setSourceTransfer(new SourceTransferObservation(
        TransferType.NATIVE, null, null, "0xa", "0xb", new BigInteger("340282366920938463463374607431768211456")));
    var blocks = new TouchedBlocks().record(1L, 10L).record(2L, 20L);

    var json = codec.encode(new PendingMessage<>(KEY, state, blocks, 3, 1, T0));
    var decoded = codec.decode(KEY, json, T0);

    assertThat(decoded.state()).isEqualTo(state);
    assertThat(decoded.touchedBlocks()).isEqualTo(blocks);
    assertThat(decoded.version()).isEqualTo(3);
    assertThat(decoded.lastFlushedVersion()).isEqualTo(1);
  }

  @Test
  void unknown_fields_are_ignored() {
    var decoded = codec.decode(KEY,
        "{\"state\":{\"transferExpected\":true,\"legacy\":1},\"version\":2,\"extra\":\"x\"}", null);

    assertThat(decoded.state().isTransferExpected()).isTrue();
    assertThat(decoded.touchedBlocks().isEmpty()).isTrue();
    assertThat(decoded.version()).isEqualTo(2);
  }

  @Test
  void payload_without_state_is_rejected() {
    assertThatThrownBy(() -> codec.decode(KEY, "{\"version\":1}", null))
        .isInstanceOf(StorageException.class)
        .hasMessageContaining("no state");
  }

  @Test
  void malformed_payload_is_reported_as_storage_failure() {
    assertThatThrownBy(() -> codec.decode(KEY, "{not json", null))
        .isInstanceOf(StorageException.class)
        .hasMessageContaining(KEY.toString());
  }
}
