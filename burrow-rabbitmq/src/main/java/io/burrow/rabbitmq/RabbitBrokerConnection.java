package io.burrow.rabbitmq;

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import io.burrow.spi.BrokerChannel;
import io.burrow.spi.BrokerConnection;
import io.burrow.spi.ConnectionClosedException;

import java.io.IOException;
import java.util.logging.Logger;

final class RabbitBrokerConnection implements BrokerConnection {
  private static final Logger logger = Logger.getLogger(RabbitBrokerConnection.class.getName());

  private final Connection connection;

  RabbitBrokerConnection(Connection connection) {
    this.connection = connection;
  }

  @Override
  public boolean isConnected() {
    return connection.isOpen();
  }

  @Override
  public BrokerChannel openChannel() throws IOException {
    try {
      Channel channel = connection.createChannel();
      if (channel == null) {
        throw new IOException("No channel available on connection " + connection);
      }
      return new RabbitBrokerChannel(channel);
    } catch (AlreadyClosedException e) {
      throw new ConnectionClosedException("Connection is closed: " + e.getMessage(), e);
    }
  }

  @Override
  public void close() throws IOException {
    if (!connection.isOpen()) {
      return;
    }
    try {
      connection.close();
    } catch (AlreadyClosedException e) {
      logger.fine("Connection already closed: " + e.getMessage());
    }
  }
}
