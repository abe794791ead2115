package io.burrow.rabbitmq;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.TrustEverythingTrustManager;
import io.burrow.connection.ConnectionSettings;
import io.burrow.connection.TlsSettings;
import io.burrow.spi.AmqpTransport;
import io.burrow.spi.BrokerConnection;
import io.burrow.spi.ConnectionFailureException;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.util.Collection;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Opens connections with a {@link ConnectionFactory} configured from {@link ConnectionSettings}.
 *
 * <p>Heartbeat, connection timeout and TCP keepalive are applied as given; the read/write
 * timeout bounds the AMQP handshake and every synchronous channel call. With TLS enabled,
 * the broker certificate is checked against {@link TlsSettings#caFile()} (or the JVM trust
 * store) and its host name is verified, unless peer verification is off.
 */
public final class RabbitTransport implements AmqpTransport {
  private static final Logger logger = Logger.getLogger(RabbitTransport.class.getName());

  @Override
  public BrokerConnection connect(ConnectionSettings settings) throws IOException {
    ConnectionFactory factory = configure(settings);
    try {
      Connection connection = factory.newConnection(settings.connectionName());
      return new RabbitBrokerConnection(connection);
    } catch (TimeoutException e) {
      throw new ConnectionFailureException("Timed out connecting to " + settings.host() + ":" + settings.port(), e);
    } catch (IOException e) {
      throw new ConnectionFailureException("Failed to connect to " + settings.host() + ":" + settings.port()
          + ": " + e.getMessage(), e);
    }
  }

  ConnectionFactory configure(ConnectionSettings settings) throws ConnectionFailureException {
    ConnectionFactory factory = new ConnectionFactory();
    factory.setHost(settings.host());
    factory.setPort(settings.port());
    factory.setUsername(settings.username());
    factory.setPassword(settings.password());
    factory.setVirtualHost(settings.virtualHost());
    factory.setRequestedHeartbeat(toSeconds(settings.heartbeat().toMillis()));
    factory.setConnectionTimeout(toMillis(settings.connectionTimeout().toMillis()));
    factory.setHandshakeTimeout(toMillis(settings.readWriteTimeout().toMillis()));
    factory.setChannelRpcTimeout(toMillis(settings.readWriteTimeout().toMillis()));
    factory.setAutomaticRecoveryEnabled(false);
    factory.setTopologyRecoveryEnabled(false);
    boolean keepalive = settings.keepalive();
    factory.setSocketConfigurator(socket -> {
      socket.setTcpNoDelay(true);
      socket.setKeepAlive(keepalive);
    });
    TlsSettings tls = settings.tls();
    if (tls != null && tls.enabled()) {
      try {
        factory.useSslProtocol(sslContext(tls));
      } catch (GeneralSecurityException | IOException e) {
        throw new ConnectionFailureException("Failed to set up TLS: " + e.getMessage(), e);
      }
      if (tls.verifyPeer()) {
        factory.enableHostnameVerification();
      } else {
        logger.log(Level.WARNING, "TLS peer verification is disabled for " + settings.host());
      }
    }
    return factory;
  }

  static SSLContext sslContext(TlsSettings tls) throws GeneralSecurityException, IOException {
    TrustManager[] trustManagers;
    if (!tls.verifyPeer()) {
      trustManagers = new TrustManager[] {new TrustEverythingTrustManager()};
    } else {
      TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
      tmf.init(tls.caFile() == null ? null : trustStore(tls.caFile()));
      trustManagers = tmf.getTrustManagers();
    }
    SSLContext context = SSLContext.getInstance("TLS");
    context.init(null, trustManagers, null);
    return context;
  }

  private static KeyStore trustStore(Path caFile) throws GeneralSecurityException, IOException {
    Collection<? extends Certificate> certificates;
    try (InputStream in = Files.newInputStream(caFile)) {
      certificates = CertificateFactory.getInstance("X.509").generateCertificates(in);
    }
    if (certificates.isEmpty()) {
      throw new GeneralSecurityException("No certificates found in " + caFile);
    }
    KeyStore keyStore = KeyStore.getInstance(KeyStore.getDefaultType());
    keyStore.load(null, null);
    int index = 0;
    for (Certificate certificate : certificates) {
      keyStore.setCertificateEntry("burrow-ca-" + index++, certificate);
    }
    return keyStore;
  }

  private static int toSeconds(long millis) {
    return (int) Math.min(Integer.MAX_VALUE, millis / 1000);
  }

  private static int toMillis(long millis) {
    return (int) Math.min(Integer.MAX_VALUE, millis);
  }
}
