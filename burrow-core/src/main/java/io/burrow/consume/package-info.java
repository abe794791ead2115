/**
 * Queue setup and the recovering consume loop.
 *
 * <p>{@link io.burrow.consume.Consumer#consume} blocks its caller. Run it on a dedicated
 * thread per queue, each with its own {@link io.burrow.connection.ConnectionManager}, and
 * stop it by interrupting that thread.
 */
package io.burrow.consume;
