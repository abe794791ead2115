package io.burrow.validation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Field rules for a payload map: presence, type, bounds and allowed values.
 *
 * <pre>{@code
 * MessageSchema schema = MessageSchema.builder()
 *     .required("order_id", FieldType.STRING)
 *     .field("amount", FieldType.NUMBER, rule -> rule.min(0))
 *     .build();
 * }</pre>
 *
 * <p>Bounds apply to string length, collection size, or numeric value depending on the
 * field's value.
 */
public final class MessageSchema {
  private final Map<String, FieldRule> fields;

  private MessageSchema(Builder builder) {
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
  }

  public static Builder builder() {
    return new Builder();
  }

  public Map<String, FieldRule> fields() {
    return fields;
  }

  /**
   * Checks {@code data} and returns field errors; an empty map means valid.
   */
  public Map<String, List<String>> check(Map<String, ?> data) {
    Map<String, List<String>> errors = new LinkedHashMap<>();
    for (Map.Entry<String, FieldRule> entry : fields.entrySet()) {
      String field = entry.getKey();
      List<String> fieldErrors = entry.getValue().check(field, data);
      if (!fieldErrors.isEmpty()) {
        errors.put(field, fieldErrors);
      }
    }
    return errors;
  }

  /**
   * Constraints on a single field.
   */
  public static final class FieldRule {
    private boolean required;
    private FieldType type = FieldType.ANY;
    private Double min;
    private Double max;
    private Set<Object> allowed;

    private FieldRule() {
    }

    public FieldRule required() {
      this.required = true;
      return this;
    }

    public FieldRule type(FieldType type) {
      this.type = Objects.requireNonNull(type, "type");
      return this;
    }

    public FieldRule min(double min) {
      this.min = min;
      return this;
    }

    public FieldRule max(double max) {
      this.max = max;
      return this;
    }

    public FieldRule in(Collection<?> values) {
      this.allowed = Set.copyOf(values);
      return this;
    }

    List<String> check(String field, Map<String, ?> data) {
      List<String> errors = new ArrayList<>();
      Object value = data == null ? null : data.get(field);
      if (value == null) {
        if (required) {
          errors.add("The " + field + " field is required.");
        }
        return errors;
      }
      if (!type.matches(value)) {
        errors.add("The " + field + " field must be of type " + type.label() + ".");
        return errors;
      }
      Double size = sizeOf(value);
      if (size != null && min != null && size < min) {
        errors.add("The " + field + " field must be at least " + format(min) + ".");
      }
      if (size != null && max != null && size > max) {
        errors.add("The " + field + " field must not be greater than " + format(max) + ".");
      }
      if (allowed != null && !allowed.contains(value)) {
        errors.add("The selected " + field + " is invalid.");
      }
      return errors;
    }

    private static Double sizeOf(Object value) {
      if (value instanceof String s) return (double) s.length();
      if (value instanceof Number n) return n.doubleValue();
      if (value instanceof Collection<?> c) return (double) c.size();
      if (value instanceof Map<?, ?> m) return (double) m.size();
      return null;
    }

    private static String format(double bound) {
      return bound == Math.rint(bound) ? Long.toString((long) bound) : Double.toString(bound);
    }
  }

  /**
   * Builder for {@link MessageSchema}.
   */
  public static final class Builder {
    private final Map<String, FieldRule> fields = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder required(String field, FieldType type) {
      return field(field, type, FieldRule::required);
    }

    public Builder optional(String field, FieldType type) {
      return field(field, type, rule -> { });
    }

    public Builder field(String field, FieldType type, java.util.function.Consumer<FieldRule> customizer) {
      Objects.requireNonNull(field, "field");
      FieldRule rule = fields.computeIfAbsent(field, k -> new FieldRule());
      rule.type(type);
      customizer.accept(rule);
      return this;
    }

    public MessageSchema build() {
      return new MessageSchema(this);
    }
  }
}
