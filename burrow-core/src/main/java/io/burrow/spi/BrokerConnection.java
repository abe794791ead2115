package io.burrow.spi;

import java.io.IOException;

/**
 * One live broker connection.
 */
public interface BrokerConnection {

  boolean isConnected();

  BrokerChannel openChannel() throws IOException;

  void close() throws IOException;
}
