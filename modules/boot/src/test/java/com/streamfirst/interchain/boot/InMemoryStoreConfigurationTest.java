package com.streamfirst.interchain.boot;

import static org.assertj.core.api.Assertions.assertThat;

import com.streamfirst.interchain.adapters.memory.InMemoryInterchainStore;
import com.streamfirst.interchain.domain.observed.ObservedMessage;
import com.streamfirst.interchain.ports.InterchainStorePort;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = "interchain.buffer.store=memory")
class InMemoryStoreConfigurationTest {

  @Autowired
  private InterchainStorePort<ObservedMessage> store;

  @Test
  void memory_store_can_be_selected() {
    assertThat(store).isInstanceOf(InMemoryInterchainStore.class);
  }
}
