package io.burrow.validation;

import java.util.List;
import java.util.Map;

/**
 * Value types a {@link MessageSchema} field may require.
 */
public enum FieldType {
  ANY,
  STRING,
  INTEGER,
  NUMBER,
  BOOLEAN,
  MAP,
  LIST;

  boolean matches(Object value) {
    return switch (this) {
      case ANY -> true;
      case STRING -> value instanceof String;
      case INTEGER -> value instanceof Integer || value instanceof Long
          || value instanceof Short || value instanceof Byte
          || value instanceof java.math.BigInteger;
      case NUMBER -> value instanceof Number;
      case BOOLEAN -> value instanceof Boolean;
      case MAP -> value instanceof Map;
      case LIST -> value instanceof List;
    };
  }

  String label() {
    return name().toLowerCase(java.util.Locale.ROOT);
  }
}
