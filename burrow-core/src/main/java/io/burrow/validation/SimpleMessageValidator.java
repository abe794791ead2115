package io.burrow.validation;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link MessageValidator} over an in-memory registry of {@link MessageSchema}s.
 *
 * <p>Thread-safe. Errors are kept per thread, so concurrent validations do not overwrite
 * each other's {@link #errors()}.
 */
public final class SimpleMessageValidator implements MessageValidator {
  private final Map<String, MessageSchema> schemas = new ConcurrentHashMap<>();
  private final ThreadLocal<Map<String, List<String>>> lastErrors =
      ThreadLocal.withInitial(Map::of);

  public SimpleMessageValidator() {
  }

  public SimpleMessageValidator(Map<String, MessageSchema> schemas) {
    schemas.forEach(this::registerSchema);
  }

  @Override
  public boolean validate(Map<String, ?> data, String schemaName) {
    MessageSchema schema = schemas.get(Objects.requireNonNull(schemaName, "schemaName"));
    if (schema == null) {
      throw new SchemaNotFoundException(schemaName);
    }
    Map<String, List<String>> errors = schema.check(data);
    lastErrors.set(Map.copyOf(errors));
    return errors.isEmpty();
  }

  @Override
  public Map<String, List<String>> errors() {
    return lastErrors.get();
  }

  @Override
  public void registerSchema(String schemaName, MessageSchema schema) {
    schemas.put(Objects.requireNonNull(schemaName, "schemaName"), Objects.requireNonNull(schema, "schema"));
  }

  @Override
  public boolean hasSchema(String schemaName) {
    return schemas.containsKey(schemaName);
  }
}
