package com.copytrading.infra.kafka.serde;

import com.copytrading.infra.kafka.contract.EventEnvelope;
import com.copytrading.infra.kafka.errors.InvalidEventMetadataException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Objects;

public class EventEnvelopeJsonCodec {
  private final ObjectMapper objectMapper;

  public EventEnvelopeJsonCodec(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  public String encode(EventEnvelope<?> envelope) {
    try {
      return objectMapper.writeValueAsString(envelope);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException(
          "Failed to encode event envelope eventType=" + envelope.eventType(), ex);
    }
  }

  /** Decodes an envelope; malformed JSON is a poison message and is never retried. */
  public <T> EventEnvelope<T> decode(String json, Class<T> payloadType) {
    if (json == null || json.isBlank()) {
      throw new InvalidEventMetadataException("Event body is empty");
    }
    try {
      JavaType envelopeType =
          objectMapper.getTypeFactory().constructParametricType(EventEnvelope.class, payloadType);
      return objectMapper.readValue(json, envelopeType);
    } catch (JsonProcessingException ex) {
      throw new InvalidEventMetadataException(
          "Failed to decode event envelope as " + payloadType.getSimpleName(), ex);
    }
  }
}
