package io.burrow.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Objects;

/**
 * {@link Serializer} backed by a Jackson {@link ObjectMapper}. The mapper's underlying
 * factory decides the wire format, so one class serves JSON and MessagePack.
 */
final class JacksonSerializer implements Serializer {
  private final ObjectMapper mapper;
  private final String contentType;
  private final SerializationFormat format;

  JacksonSerializer(ObjectMapper mapper, String contentType, SerializationFormat format) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.contentType = Objects.requireNonNull(contentType, "contentType");
    this.format = Objects.requireNonNull(format, "format");
  }

  @Override
  public byte[] serialize(Object data) {
    try {
      return mapper.writeValueAsBytes(data);
    } catch (IOException e) {
      throw new SerializationException("Failed to serialize payload as " + format.key(), e);
    }
  }

  @Override
  public Object deserialize(byte[] bytes) {
    try {
      return mapper.readValue(bytes, Object.class);
    } catch (IOException e) {
      throw new SerializationException("Failed to deserialize " + format.key() + " payload", e);
    }
  }

  @Override
  public String contentType() {
    return contentType;
  }

  @Override
  public SerializationFormat format() {
    return format;
  }
}
