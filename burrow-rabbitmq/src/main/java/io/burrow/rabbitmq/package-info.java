/**
 * {@link io.burrow.spi.AmqpTransport} backed by the RabbitMQ Java client.
 *
 * <p>The client's automatic connection recovery is switched off; reconnection is driven by
 * {@link io.burrow.connection.ConnectionManager} and {@link io.burrow.consume.Consumer}.
 */
package io.burrow.rabbitmq;
