package io.burrow;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A queue declared ahead of time in configuration and referenced by key.
 *
 * @param name        queue name on the broker
 * @param bindingKeys binding keys on the configured exchange
 * @param durable     whether the queue survives broker restarts
 * @param autoDelete  whether the queue is deleted after its last consumer leaves
 * @param arguments   queue arguments
 */
public record QueueDefinition(String name, List<String> bindingKeys, boolean durable, boolean autoDelete,
                              Map<String, Object> arguments) {

  public QueueDefinition {
    Objects.requireNonNull(name, "name");
    bindingKeys = bindingKeys == null ? List.of() : List.copyOf(bindingKeys);
    arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
  }

  /**
   * Durable queue with the given binding keys and no arguments.
   */
  public static QueueDefinition of(String name, String... bindingKeys) {
    return new QueueDefinition(name, List.of(bindingKeys), true, false, Map.of());
  }
}
