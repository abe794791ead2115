package io.burrow.validation;

/**
 * Validation was requested against a schema name nobody registered.
 */
public class SchemaNotFoundException extends RuntimeException {
  private final String schemaName;

  public SchemaNotFoundException(String schemaName) {
    super("Schema not found: " + schemaName);
    this.schemaName = schemaName;
  }

  public String schemaName() {
    return schemaName;
  }
}
