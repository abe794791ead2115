/**
 * Service Provider Interfaces for pluggable components.
 *
 * <p>{@link io.burrow.spi.AmqpTransport}, {@link io.burrow.spi.BrokerConnection} and
 * {@link io.burrow.spi.BrokerChannel} abstract the AMQP client library; the
 * {@code burrow-rabbitmq} module implements them on the RabbitMQ Java client.
 * {@link io.burrow.spi.MetricsExporter} bridges counters into a metrics backend.
 *
 * <p>The transport exception hierarchy lives here as well:
 * {@link io.burrow.spi.ConnectionFailureException} and its subtypes
 * {@link io.burrow.spi.ConnectionClosedException} and
 * {@link io.burrow.spi.ChannelClosedException}, which drive consumer reconnection.
 */
package io.burrow.spi;
