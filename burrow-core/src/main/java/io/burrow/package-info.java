/**
 * Resilient AMQP messaging.
 *
 * <p>{@link io.burrow.MessagingService} is the entry point. It composes the building blocks
 * in the sub-packages:
 * <ul>
 *   <li>{@code io.burrow.connection}: lazy connection and channel lifecycle</li>
 *   <li>{@code io.burrow.publish}: single and transactional batch publishing</li>
 *   <li>{@code io.burrow.consume}: queue setup and the recovering consume loop</li>
 *   <li>{@code io.burrow.resilience}: retry policy and circuit breaker</li>
 *   <li>{@code io.burrow.serialization}: JSON and MessagePack payloads</li>
 *   <li>{@code io.burrow.validation}: schema validation</li>
 *   <li>{@code io.burrow.spi}: transport and metrics extension points</li>
 * </ul>
 */
package io.burrow;
