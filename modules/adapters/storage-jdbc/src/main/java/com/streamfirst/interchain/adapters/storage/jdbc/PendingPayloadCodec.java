package com.streamfirst.interchain.adapters.storage.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.streamfirst.interchain.domain.Consolidatable;
import com.streamfirst.interchain.domain.MessageKey;
import com.streamfirst.interchain.domain.PendingMessage;
import com.streamfirst.interchain.domain.TouchedBlocks;
import com.streamfirst.interchain.ports.StorageException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.NonNull;

/**
 * JSON form of an offloaded entry:
 * {@code {"state": ..., "touchedBlocks": {"<chain>": [blocks]}, "version": n, "lastFlushedVersion": m}}.
 * The time the entry entered the hot tier lives in its own column.
 *
 * @param <S> the buffered state type; must be Jackson-bindable
 */
public class PendingPayloadCodec<S extends Consolidatable<S>> {

  private static final TypeReference<Map<Long, List<Long>>> BLOCKS_TYPE = new TypeReference<>() {};

  private final ObjectMapper mapper;
  private final Class<S> stateType;

  public PendingPayloadCodec(@NonNull ObjectMapper mapper, @NonNull Class<S> stateType) {
    this.mapper = mapper;
    this.stateType = stateType;
  }

  public PendingPayloadCodec(Class<S> stateType) {
    this(defaultMapper(), stateType);
  }

  public static ObjectMapper defaultMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  public String encode(PendingMessage<S> pending) {
    ObjectNode node = mapper.createObjectNode();
    node.set("state", mapper.valueToTree(pending.state()));
    node.set("touchedBlocks", mapper.valueToTree(pending.touchedBlocks().asMap()));
    node.put("version", pending.version());
    node.put("lastFlushedVersion", pending.lastFlushedVersion());
    try {
      return mapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new StorageException("Failed to serialize pending payload of " + pending.key(), e);
    }
  }

  public PendingMessage<S> decode(MessageKey key, String payload, Instant hotSince) {
    try {
      JsonNode node = mapper.readTree(payload);
      if (!node.hasNonNull("state")) {
        throw new StorageException("Pending payload of " + key + " has no state");
      }
      S state = mapper.treeToValue(node.get("state"), stateType);
      Map<Long, List<Long>> blocks =
          node.hasNonNull("touchedBlocks")
              ? mapper.convertValue(node.get("touchedBlocks"), BLOCKS_TYPE)
              : Map.of();
      return new PendingMessage<>(
          key,
          state,
          TouchedBlocks.of(blocks),
          node.path("version").asLong(),
          node.path("lastFlushedVersion").asLong(),
          hotSince);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new StorageException("Failed to deserialize pending payload of " + key, e);
    }
  }
}
