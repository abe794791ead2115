package io.burrow.rabbitmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.LongString;
import io.burrow.MessageProperties;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between {@link MessageProperties} and the client's {@link AMQP.BasicProperties}.
 * Header strings arrive from the broker as {@link LongString} and are turned back into
 * {@link String}, including inside nested tables and arrays.
 */
final class AmqpProperties {

  private AmqpProperties() {
  }

  static AMQP.BasicProperties toAmqp(MessageProperties properties) {
    return new AMQP.BasicProperties.Builder()
        .contentType(properties.contentType())
        .contentEncoding(properties.contentEncoding())
        .headers(properties.headers().isEmpty() ? null : new LinkedHashMap<>(properties.headers()))
        .deliveryMode(properties.deliveryMode())
        .priority(properties.priority())
        .correlationId(properties.correlationId())
        .replyTo(properties.replyTo())
        .expiration(properties.expiration())
        .messageId(properties.messageId())
        .timestamp(properties.timestamp() == null ? null : Date.from(properties.timestamp()))
        .type(properties.type())
        .userId(properties.userId())
        .appId(properties.appId())
        .build();
  }

  static MessageProperties fromAmqp(AMQP.BasicProperties properties) {
    if (properties == null) {
      return MessageProperties.EMPTY;
    }
    MessageProperties.Builder builder = MessageProperties.builder()
        .contentType(properties.getContentType())
        .contentEncoding(properties.getContentEncoding())
        .deliveryMode(properties.getDeliveryMode())
        .priority(properties.getPriority())
        .correlationId(properties.getCorrelationId())
        .replyTo(properties.getReplyTo())
        .expiration(properties.getExpiration())
        .messageId(properties.getMessageId())
        .timestamp(properties.getTimestamp() == null ? null : properties.getTimestamp().toInstant())
        .type(properties.getType())
        .userId(properties.getUserId())
        .appId(properties.getAppId());
    if (properties.getHeaders() != null) {
      builder.headers(table(properties.getHeaders()));
    }
    return builder.build();
  }

  private static Map<String, Object> table(Map<String, Object> headers) {
    Map<String, Object> converted = new LinkedHashMap<>();
    headers.forEach((name, value) -> converted.put(name, value(value)));
    return converted;
  }

  @SuppressWarnings("unchecked")
  private static Object value(Object value) {
    if (value instanceof LongString longString) {
      return longString.toString();
    }
    if (value instanceof Map<?, ?> map) {
      return table((Map<String, Object>) map);
    }
    if (value instanceof List<?> list) {
      List<Object> converted = new ArrayList<>(list.size());
      for (Object item : list) {
        converted.add(value(item));
      }
      return converted;
    }
    return value;
  }
}
