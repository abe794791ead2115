package io.burrow.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A payload failed schema validation. Consumers reject such messages without requeueing,
 * since redelivery cannot fix them.
 */
public class MessageValidationException extends RuntimeException {
  private final Map<String, List<String>> errors;

  public MessageValidationException(String message, Map<String, List<String>> errors) {
    super(message);
    this.errors = errors == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(errors));
  }

  /**
   * Field errors keyed by field name.
   */
  public Map<String, List<String>> errors() {
    return errors;
  }
}
