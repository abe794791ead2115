package io.burrow.connection;

import java.time.Duration;
import java.util.Objects;

/**
 * Broker endpoint, credentials and transport tuning.
 */
public final class ConnectionSettings {
  private final String host;
  private final int port;
  private final String username;
  private final String password;
  private final String virtualHost;
  private final TlsSettings tls;
  private final Duration heartbeat;
  private final Duration connectionTimeout;
  private final Duration readWriteTimeout;
  private final boolean keepalive;
  private final String connectionName;

  private ConnectionSettings(Builder builder) {
    this.host = Objects.requireNonNull(builder.host, "host");
    if (builder.port < 1 || builder.port > 65535) {
      throw new IllegalArgumentException("port must be within [1, 65535], got: " + builder.port);
    }
    this.port = builder.port;
    this.username = Objects.requireNonNull(builder.username, "username");
    this.password = Objects.requireNonNull(builder.password, "password");
    this.virtualHost = Objects.requireNonNull(builder.virtualHost, "virtualHost");
    this.tls = builder.tls != null ? builder.tls : TlsSettings.DISABLED;
    this.heartbeat = requireNonNegative(builder.heartbeat, "heartbeat");
    this.connectionTimeout = requireNonNegative(builder.connectionTimeout, "connectionTimeout");
    this.readWriteTimeout = requireNonNegative(builder.readWriteTimeout, "readWriteTimeout");
    this.keepalive = builder.keepalive;
    this.connectionName = builder.connectionName;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Settings for a local broker with the default guest account.
   */
  public static ConnectionSettings defaults() {
    return builder().build();
  }

  private static Duration requireNonNegative(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isNegative()) {
      throw new IllegalArgumentException(name + " must not be negative");
    }
    return value;
  }

  public String host() {
    return host;
  }

  public int port() {
    return port;
  }

  public String username() {
    return username;
  }

  public String password() {
    return password;
  }

  public String virtualHost() {
    return virtualHost;
  }

  public TlsSettings tls() {
    return tls;
  }

  public Duration heartbeat() {
    return heartbeat;
  }

  public Duration connectionTimeout() {
    return connectionTimeout;
  }

  public Duration readWriteTimeout() {
    return readWriteTimeout;
  }

  public boolean keepalive() {
    return keepalive;
  }

  /**
   * Client-provided connection name shown in the broker's management UI, or {@code null}.
   */
  public String connectionName() {
    return connectionName;
  }

  @Override
  public String toString() {
    return "ConnectionSettings{host=" + host + ", port=" + port + ", virtualHost=" + virtualHost
        + ", username=" + username + ", tls=" + tls.enabled() + "}";
  }

  /**
   * Builder for {@link ConnectionSettings}.
   */
  public static final class Builder {
    private String host = "localhost";
    private int port = 5672;
    private String username = "guest";
    private String password = "guest";
    private String virtualHost = "/";
    private TlsSettings tls;
    private Duration heartbeat = Duration.ofSeconds(60);
    private Duration connectionTimeout = Duration.ofSeconds(3);
    private Duration readWriteTimeout = Duration.ofSeconds(3);
    private boolean keepalive;
    private String connectionName;

    private Builder() {
    }

    /** Optional. Defaults to {@code localhost}. */
    public Builder host(String host) {
      this.host = host;
      return this;
    }

    /** Optional. Defaults to 5672. */
    public Builder port(int port) {
      this.port = port;
      return this;
    }

    /** Optional. Defaults to {@code guest}. */
    public Builder username(String username) {
      this.username = username;
      return this;
    }

    /** Optional. Defaults to {@code guest}. */
    public Builder password(String password) {
      this.password = password;
      return this;
    }

    /** Optional. Defaults to {@code /}. */
    public Builder virtualHost(String virtualHost) {
      this.virtualHost = virtualHost;
      return this;
    }

    /** Optional. Defaults to {@link TlsSettings#DISABLED}. */
    public Builder tls(TlsSettings tls) {
      this.tls = tls;
      return this;
    }

    /** Optional. Defaults to 60 seconds; zero disables heartbeats. */
    public Builder heartbeat(Duration heartbeat) {
      this.heartbeat = heartbeat;
      return this;
    }

    /** Optional. Defaults to 3 seconds. */
    public Builder connectionTimeout(Duration connectionTimeout) {
      this.connectionTimeout = connectionTimeout;
      return this;
    }

    /** Optional. Defaults to 3 seconds. */
    public Builder readWriteTimeout(Duration readWriteTimeout) {
      this.readWriteTimeout = readWriteTimeout;
      return this;
    }

    /** Optional. Defaults to {@code false}. */
    public Builder keepalive(boolean keepalive) {
      this.keepalive = keepalive;
      return this;
    }

    /** Optional. No name by default. */
    public Builder connectionName(String connectionName) {
      this.connectionName = connectionName;
      return this;
    }

    public ConnectionSettings build() {
      return new ConnectionSettings(this);
    }
  }
}
