package io.burrow.connection;

import java.nio.file.Path;

/**
 * TLS options for the broker connection.
 *
 * @param enabled    whether to connect over TLS
 * @param verifyPeer whether to verify the broker certificate and host name
 * @param caFile     PEM file with the CA certificate(s) to trust; {@code null} uses the JVM trust store
 */
public record TlsSettings(boolean enabled, boolean verifyPeer, Path caFile) {

  public static final TlsSettings DISABLED = new TlsSettings(false, true, null);
}
