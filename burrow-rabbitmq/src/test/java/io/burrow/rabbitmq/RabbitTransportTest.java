package io.burrow.rabbitmq;

import com.rabbitmq.client.ConnectionFactory;
import io.burrow.connection.ConnectionSettings;
import io.burrow.connection.TlsSettings;
import io.burrow.spi.ConnectionFailureException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RabbitTransportTest {

  private final RabbitTransport transport = new RabbitTransport();

  @Test
  void appliesConnectionSettings() throws Exception {
    ConnectionSettings settings = ConnectionSettings.builder()
        .host("rabbit.internal")
        .port(5673)
        .username("app")
        .password("secret")
        .virtualHost("/bookings")
        .heartbeat(Duration.ofSeconds(30))
        .connectionTimeout(Duration.ofSeconds(2))
        .readWriteTimeout(Duration.ofSeconds(4))
        .build();

    ConnectionFactory factory = transport.configure(settings);

    assertEquals("rabbit.internal", factory.getHost());
    assertEquals(5673, factory.getPort());
    assertEquals("app", factory.getUsername());
    assertEquals("secret", factory.getPassword());
    assertEquals("/bookings", factory.getVirtualHost());
    assertEquals(30, factory.getRequestedHeartbeat());
    assertEquals(2000, factory.getConnectionTimeout());
    assertEquals(4000, factory.getHandshakeTimeout());
    assertEquals(4000, factory.getChannelRpcTimeout());
    assertFalse(factory.isAutomaticRecoveryEnabled());
    assertFalse(factory.isSSL());
  }

  @Test
  void enablesTlsWithoutPeerVerification() throws Exception {
    ConnectionSettings settings = ConnectionSettings.builder()
        .tls(new TlsSettings(true, false, null))
        .build();

    assertTrue(transport.configure(settings).isSSL());
  }

  @Test
  void enablesTlsWithJvmTrustStore() throws Exception {
    ConnectionSettings settings = ConnectionSettings.builder()
        .tls(new TlsSettings(true, true, null))
        .build();

    assertTrue(transport.configure(settings).isSSL());
  }

  @Test
  void unreadableCaFileFailsConfiguration(@TempDir Path dir) throws IOException {
    Path caFile = Files.writeString(dir.resolve("ca.pem"), "not a certificate");
    ConnectionSettings settings = ConnectionSettings.builder()
        .tls(new TlsSettings(true, true, caFile))
        .build();

    assertThrows(ConnectionFailureException.class, () -> transport.configure(settings));
  }

  @Test
  void unreachableBrokerRaisesConnectionFailure() {
    ConnectionSettings settings = ConnectionSettings.builder()
        .host("127.0.0.1")
        .port(1)
        .connectionTimeout(Duration.ofMillis(500))
        .build();

    assertThrows(ConnectionFailureException.class, () -> transport.connect(settings));
  }
}
