/**
 * Payload validation against named schemas.
 *
 * <p>{@link io.burrow.validation.SimpleMessageValidator} is the default implementation. Plug
 * in another {@link io.burrow.validation.MessageValidator} to delegate to an external
 * validation library.
 */
package io.burrow.validation;
