package io.burrow.spi;

import io.burrow.Delivery;

/**
 * Receives deliveries registered through {@link BrokerChannel#basicConsume}.
 *
 * <p>Invoked on the thread that calls {@link BrokerChannel#waitForDeliveries}.
 */
@FunctionalInterface
public interface DeliveryHandler {

  void handle(Delivery delivery) throws Exception;
}
