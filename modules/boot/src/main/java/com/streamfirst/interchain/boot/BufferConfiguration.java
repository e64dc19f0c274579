package com.streamfirst.interchain.boot;

import com.streamfirst.interchain.adapters.memory.InMemoryInterchainStore;
import com.streamfirst.interchain.adapters.memory.InMemoryMetricsAdapter;
import com.streamfirst.interchain.adapters.storage.jdbc.InterchainSchema;
import com.streamfirst.interchain.adapters.storage.jdbc.JdbcInterchainStore;
import com.streamfirst.interchain.adapters.storage.jdbc.PendingPayloadCodec;
import com.streamfirst.interchain.application.BufferMaintenance;
import com.streamfirst.interchain.application.BufferSettings;
import com.streamfirst.interchain.application.MaintenanceScheduler;
import com.streamfirst.interchain.application.MessageBuffer;
import com.streamfirst.interchain.domain.observed.ObservedMessage;
import com.streamfirst.interchain.ports.InterchainStorePort;
import com.streamfirst.interchain.ports.MetricsPort;
import java.time.Clock;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the message buffer for {@link ObservedMessage} state: storage adapter, hot tier,
 * maintenance cycle and its background loop.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(BufferProperties.class)
public class BufferConfiguration {

  // --- Adapters ---

  @Bean
  public MetricsPort bufferMetrics() {
    return new InMemoryMetricsAdapter();
  }

  @Bean
  public Clock bufferClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnProperty(name = "interchain.buffer.store", havingValue = "jdbc", matchIfMissing = true)
  public InterchainStorePort<ObservedMessage> jdbcInterchainStore(
      DataSource dataSource, BufferProperties properties) {
    if (properties.isInitializeSchema()) {
      InterchainSchema.createSchema(dataSource);
    }
    log.info("Using JDBC interchain store");
    return new JdbcInterchainStore<>(dataSource, new PendingPayloadCodec<>(ObservedMessage.class));
  }

  @Bean
  @ConditionalOnProperty(name = "interchain.buffer.store", havingValue = "memory")
  public InterchainStorePort<ObservedMessage> inMemoryInterchainStore() {
    log.warn("Using in-memory interchain store; nothing survives a restart");
    return new InMemoryInterchainStore<>();
  }

  // --- Buffer ---

  @Bean
  public BufferSettings bufferSettings(BufferProperties properties) {
    return properties.toSettings();
  }

  @Bean
  public MessageBuffer<ObservedMessage> messageBuffer(
      InterchainStorePort<ObservedMessage> store, MetricsPort bufferMetrics, Clock bufferClock) {
    return new MessageBuffer<>(ObservedMessage::new, store, bufferMetrics, bufferClock);
  }

  @Bean
  public BufferMaintenance<ObservedMessage> bufferMaintenance(
      MessageBuffer<ObservedMessage> messageBuffer,
      InterchainStorePort<ObservedMessage> store,
      BufferSettings bufferSettings,
      MetricsPort bufferMetrics) {
    return new BufferMaintenance<>(messageBuffer, store, bufferSettings, bufferMetrics);
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  public MaintenanceScheduler maintenanceScheduler(
      BufferMaintenance<ObservedMessage> bufferMaintenance, BufferSettings bufferSettings) {
    return new MaintenanceScheduler(bufferMaintenance, bufferSettings.maintenanceInterval());
  }
}
