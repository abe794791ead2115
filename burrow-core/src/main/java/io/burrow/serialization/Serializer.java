package io.burrow.serialization;

/**
 * Converts message payloads to and from bytes.
 *
 * @see SerializationFormat#serializer()
 */
public interface Serializer {

  /**
   * @throws SerializationException if {@code data} cannot be encoded
   */
  byte[] serialize(Object data);

  /**
   * Decodes into plain values: maps, lists, strings, numbers, booleans or {@code null}.
   *
   * @throws SerializationException if {@code bytes} are not valid in this format
   */
  Object deserialize(byte[] bytes);

  /**
   * MIME type set as the message's {@code content_type} property.
   */
  String contentType();

  SerializationFormat format();
}
