package io.burrow.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.msgpack.jackson.dataformat.MessagePackMapper;

import java.util.Locale;
import java.util.Map;

/**
 * Supported payload encodings.
 *
 * <p>The format of a message travels in its {@value #HEADER} application header, which
 * consumers use to pick the matching {@link Serializer}. Messages without the header are
 * JSON.
 */
public enum SerializationFormat {
  JSON("json", "application/json"),
  MSGPACK("msgpack", "application/msgpack");

  /** Application header naming the payload encoding. */
  public static final String HEADER = "serialization_format";

  private final String key;
  private final String contentType;
  private volatile Serializer serializer;

  SerializationFormat(String key, String contentType) {
    this.key = key;
    this.contentType = contentType;
  }

  public String key() {
    return key;
  }

  public String contentType() {
    return contentType;
  }

  /**
   * Shared serializer for this format. Serializers are stateless and thread-safe.
   */
  public Serializer serializer() {
    Serializer s = serializer;
    if (s == null) {
      s = new JacksonSerializer(newMapper(), contentType, this);
      serializer = s;
    }
    return s;
  }

  private ObjectMapper newMapper() {
    ObjectMapper mapper = switch (this) {
      case JSON -> JsonMapper.builder().build();
      case MSGPACK -> new MessagePackMapper();
    };
    mapper.findAndRegisterModules();
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    return mapper;
  }

  /**
   * Parses a format key such as {@code "json"} or {@code "msgpack"}, ignoring case.
   *
   * @throws IllegalArgumentException for an unknown format
   */
  public static SerializationFormat of(String key) {
    if (key != null) {
      String normalized = key.trim().toLowerCase(Locale.ROOT);
      for (SerializationFormat format : values()) {
        if (format.key.equals(normalized)) {
          return format;
        }
      }
    }
    throw new IllegalArgumentException("Unsupported serialization format: " + key);
  }

  /**
   * Detects the format named by the {@value #HEADER} header, falling back to
   * {@link #JSON} when the header is absent or names an unknown format.
   */
  public static SerializationFormat fromHeaders(Map<String, ?> headers) {
    if (headers == null) {
      return JSON;
    }
    Object value = headers.get(HEADER);
    if (value == null) {
      return JSON;
    }
    try {
      return of(value.toString());
    } catch (IllegalArgumentException e) {
      return JSON;
    }
  }
}
