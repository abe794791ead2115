/**
 * Connection and channel lifecycle.
 *
 * <p>{@link io.burrow.connection.ConnectionManager} opens the connection lazily through an
 * {@link io.burrow.spi.AmqpTransport}, re-creates it when it drops, and keeps the configured
 * exchange declared on the current channel.
 */
package io.burrow.connection;
