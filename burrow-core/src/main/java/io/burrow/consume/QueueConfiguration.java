package io.burrow.consume;

import java.util.List;
import java.util.Map;

/**
 * How a queue was last declared and bound, replayed after a reconnect.
 *
 * @param bindingKeys binding keys, in declaration order
 * @param durable     whether the queue survives broker restarts
 * @param autoDelete  whether the queue is deleted after its last consumer leaves
 * @param arguments   optional queue arguments such as {@code x-dead-letter-exchange}
 */
public record QueueConfiguration(List<String> bindingKeys, boolean durable, boolean autoDelete,
                                 Map<String, Object> arguments) {

  public QueueConfiguration {
    bindingKeys = bindingKeys == null ? List.of() : List.copyOf(bindingKeys);
    arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
  }
}
