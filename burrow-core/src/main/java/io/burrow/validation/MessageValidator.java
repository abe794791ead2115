package io.burrow.validation;

import java.util.List;
import java.util.Map;

/**
 * Validates message payloads against named schemas.
 *
 * @see SimpleMessageValidator
 */
public interface MessageValidator {

  /**
   * Validates {@code data} against the schema registered as {@code schemaName}.
   *
   * @return {@code true} if the payload is valid; otherwise {@link #errors()} describes why
   * @throws SchemaNotFoundException if no schema is registered under that name
   */
  boolean validate(Map<String, ?> data, String schemaName);

  /**
   * Field errors of the most recent failed {@link #validate} call on the current thread,
   * keyed by field name. Empty after a successful validation.
   */
  Map<String, List<String>> errors();

  void registerSchema(String schemaName, MessageSchema schema);

  boolean hasSchema(String schemaName);
}
