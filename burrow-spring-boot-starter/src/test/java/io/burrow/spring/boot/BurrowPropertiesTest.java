package io.burrow.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BurrowPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(BurrowProperties.class);
            assertEquals("localhost", props.getConnection().getHost());
            assertEquals(5672, props.getConnection().getPort());
            assertEquals("guest", props.getConnection().getUser());
            assertEquals("guest", props.getConnection().getPassword());
            assertEquals("/", props.getConnection().getVhost());
            assertEquals(Duration.ofSeconds(60), props.getConnection().getHeartbeat());
            assertEquals(Duration.ofSeconds(3), props.getConnection().getConnectionTimeout());
            assertEquals(Duration.ofSeconds(3), props.getConnection().getReadWriteTimeout());
            assertFalse(props.getConnection().isKeepalive());
            assertFalse(props.getConnection().getSsl().isEnabled());
            assertTrue(props.getConnection().getSsl().isVerifyPeer());
            assertNull(props.getConnection().getSsl().getCaFile());
            assertEquals("booking_events", props.getExchange().getName());
            assertEquals("topic", props.getExchange().getType());
            assertTrue(props.getExchange().isDurable());
            assertFalse(props.getExchange().isAutoDelete());
            assertEquals(3, props.getResilience().getMaxAttempts());
            assertEquals(100, props.getResilience().getBaseDelayMs());
            assertEquals(5000, props.getResilience().getMaxDelayMs());
            assertEquals(0.2, props.getResilience().getJitterFactor());
            assertEquals(5, props.getResilience().getFailureThreshold());
            assertEquals(Duration.ofSeconds(30), props.getResilience().getResetTimeout());
            assertEquals(1, props.getConsumer().getPrefetchCount());
            assertEquals(Duration.ZERO, props.getConsumer().getWaitTimeout());
            assertEquals(Duration.ofSeconds(5), props.getConsumer().getReconnectDelay());
            assertEquals(3, props.getConsumer().getReconnectMaxRetries());
            assertFalse(props.getConsumer().isRequeueOnError());
            assertEquals(100, props.getPublisher().getBatchSize());
            assertFalse(props.getPublisher().isConfirmSelect());
            assertEquals("json", props.getSerialization().getFormat());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("burrow", props.getMetrics().getNamePrefix());
            assertFalse(props.isDebug());
            assertTrue(props.getQueues().isEmpty());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "burrow.debug=true",
                "burrow.connection.host=rabbit.internal",
                "burrow.connection.port=5671",
                "burrow.connection.user=app",
                "burrow.connection.vhost=/bookings",
                "burrow.connection.heartbeat=30s",
                "burrow.connection.read-write-timeout=10s",
                "burrow.connection.ssl.enabled=true",
                "burrow.connection.ssl.verify-peer=false",
                "burrow.connection.ssl.ca-file=/etc/ssl/rabbit-ca.pem",
                "burrow.exchange.name=orders",
                "burrow.exchange.type=direct",
                "burrow.resilience.max-attempts=5",
                "burrow.resilience.reset-timeout=1m",
                "burrow.consumer.prefetch-count=20",
                "burrow.consumer.requeue-on-error=true",
                "burrow.consumer.reconnect-delay=500ms",
                "burrow.publisher.batch-size=25",
                "burrow.publisher.confirm-select=true",
                "burrow.serialization.format=msgpack",
                "burrow.metrics.name-prefix=orders.messaging",
                "burrow.queues.orders.name=orders-queue",
                "burrow.queues.orders.binding-keys=order.created,order.updated",
                "burrow.queues.orders.arguments.x-max-length=1000"
        ).run(ctx -> {
            var props = ctx.getBean(BurrowProperties.class);
            assertTrue(props.isDebug());
            assertEquals("rabbit.internal", props.getConnection().getHost());
            assertEquals(5671, props.getConnection().getPort());
            assertEquals("app", props.getConnection().getUser());
            assertEquals("/bookings", props.getConnection().getVhost());
            assertEquals(Duration.ofSeconds(30), props.getConnection().getHeartbeat());
            assertEquals(Duration.ofSeconds(10), props.getConnection().getReadWriteTimeout());
            assertTrue(props.getConnection().getSsl().isEnabled());
            assertFalse(props.getConnection().getSsl().isVerifyPeer());
            assertEquals("/etc/ssl/rabbit-ca.pem", props.getConnection().getSsl().getCaFile());
            assertEquals("orders", props.getExchange().getName());
            assertEquals("direct", props.getExchange().getType());
            assertEquals(5, props.getResilience().getMaxAttempts());
            assertEquals(Duration.ofMinutes(1), props.getResilience().getResetTimeout());
            assertEquals(20, props.getConsumer().getPrefetchCount());
            assertTrue(props.getConsumer().isRequeueOnError());
            assertEquals(Duration.ofMillis(500), props.getConsumer().getReconnectDelay());
            assertEquals(25, props.getPublisher().getBatchSize());
            assertTrue(props.getPublisher().isConfirmSelect());
            assertEquals("msgpack", props.getSerialization().getFormat());
            assertEquals("orders.messaging", props.getMetrics().getNamePrefix());

            var queue = props.getQueues().get("orders");
            assertEquals("orders-queue", queue.getName());
            assertEquals(List.of("order.created", "order.updated"), queue.getBindingKeys());
            assertEquals("1000", queue.getArguments().get("x-max-length"));
        });
    }

    @Configuration
    @EnableConfigurationProperties(BurrowProperties.class)
    static class PropsConfig {
    }
}
