package io.burrow.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for burrow messaging.
 *
 * @see BurrowAutoConfiguration
 */
@ConfigurationProperties(prefix = "burrow")
public class BurrowProperties {

    /**
     * Log connection, publish and queue activity at FINE level.
     */
    private boolean debug;

    private final Connection connection = new Connection();
    private final Exchange exchange = new Exchange();
    private final Resilience resilience = new Resilience();
    private final Consumer consumer = new Consumer();
    private final Publisher publisher = new Publisher();
    private final Serialization serialization = new Serialization();
    private final Metrics metrics = new Metrics();

    /**
     * Predefined queues, by key.
     */
    private final Map<String, Queue> queues = new LinkedHashMap<>();

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    public Connection getConnection() {
        return connection;
    }

    public Exchange getExchange() {
        return exchange;
    }

    public Resilience getResilience() {
        return resilience;
    }

    public Consumer getConsumer() {
        return consumer;
    }

    public Publisher getPublisher() {
        return publisher;
    }

    public Serialization getSerialization() {
        return serialization;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public Map<String, Queue> getQueues() {
        return queues;
    }

    public static class Connection {
        private String host = "localhost";
        private int port = 5672;
        private String user = "guest";
        private String password = "guest";
        private String vhost = "/";
        private Duration heartbeat = Duration.ofSeconds(60);
        private Duration connectionTimeout = Duration.ofSeconds(3);
        private Duration readWriteTimeout = Duration.ofSeconds(3);
        private boolean keepalive;
        /**
         * Client-provided connection name shown in the broker management UI.
         */
        private String name;
        private final Ssl ssl = new Ssl();

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getUser() {
            return user;
        }

        public void setUser(String user) {
            this.user = user;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getVhost() {
            return vhost;
        }

        public void setVhost(String vhost) {
            this.vhost = vhost;
        }

        public Duration getHeartbeat() {
            return heartbeat;
        }

        public void setHeartbeat(Duration heartbeat) {
            this.heartbeat = heartbeat;
        }

        public Duration getConnectionTimeout() {
            return connectionTimeout;
        }

        public void setConnectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
        }

        public Duration getReadWriteTimeout() {
            return readWriteTimeout;
        }

        public void setReadWriteTimeout(Duration readWriteTimeout) {
            this.readWriteTimeout = readWriteTimeout;
        }

        public boolean isKeepalive() {
            return keepalive;
        }

        public void setKeepalive(boolean keepalive) {
            this.keepalive = keepalive;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public Ssl getSsl() {
            return ssl;
        }
    }

    public static class Ssl {
        private boolean enabled;
        private boolean verifyPeer = true;
        /**
         * PEM file with the CA certificates to trust. Defaults to the JVM trust store.
         */
        private String caFile;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isVerifyPeer() {
            return verifyPeer;
        }

        public void setVerifyPeer(boolean verifyPeer) {
            this.verifyPeer = verifyPeer;
        }

        public String getCaFile() {
            return caFile;
        }

        public void setCaFile(String caFile) {
            this.caFile = caFile;
        }
    }

    public static class Exchange {
        private String name = "booking_events";
        /**
         * Exchange type: direct, fanout, topic or headers.
         */
        private String type = "topic";
        private boolean durable = true;
        private boolean autoDelete;
        private boolean passive;
        private boolean internal;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public boolean isDurable() {
            return durable;
        }

        public void setDurable(boolean durable) {
            this.durable = durable;
        }

        public boolean isAutoDelete() {
            return autoDelete;
        }

        public void setAutoDelete(boolean autoDelete) {
            this.autoDelete = autoDelete;
        }

        public boolean isPassive() {
            return passive;
        }

        public void setPassive(boolean passive) {
            this.passive = passive;
        }

        public boolean isInternal() {
            return internal;
        }

        public void setInternal(boolean internal) {
            this.internal = internal;
        }
    }

    public static class Resilience {
        private int maxAttempts = 3;
        private long baseDelayMs = 100;
        private long maxDelayMs = 5000;
        private double jitterFactor = 0.2;
        private int failureThreshold = 5;
        private Duration resetTimeout = Duration.ofSeconds(30);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public double getJitterFactor() {
            return jitterFactor;
        }

        public void setJitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
        }

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getResetTimeout() {
            return resetTimeout;
        }

        public void setResetTimeout(Duration resetTimeout) {
            this.resetTimeout = resetTimeout;
        }
    }

    public static class Consumer {
        private int prefetchCount = 1;
        /**
         * How long one wait for deliveries may block. Zero waits indefinitely.
         */
        private Duration waitTimeout = Duration.ZERO;
        private Duration reconnectDelay = Duration.ofSeconds(5);
        private int reconnectMaxRetries = 3;
        private boolean stopOnCriticalError;
        private boolean requeueOnError;
        private boolean throwExceptions;
        private boolean autoAck;

        public int getPrefetchCount() {
            return prefetchCount;
        }

        public void setPrefetchCount(int prefetchCount) {
            this.prefetchCount = prefetchCount;
        }

        public Duration getWaitTimeout() {
            return waitTimeout;
        }

        public void setWaitTimeout(Duration waitTimeout) {
            this.waitTimeout = waitTimeout;
        }

        public Duration getReconnectDelay() {
            return reconnectDelay;
        }

        public void setReconnectDelay(Duration reconnectDelay) {
            this.reconnectDelay = reconnectDelay;
        }

        public int getReconnectMaxRetries() {
            return reconnectMaxRetries;
        }

        public void setReconnectMaxRetries(int reconnectMaxRetries) {
            this.reconnectMaxRetries = reconnectMaxRetries;
        }

        public boolean isStopOnCriticalError() {
            return stopOnCriticalError;
        }

        public void setStopOnCriticalError(boolean stopOnCriticalError) {
            this.stopOnCriticalError = stopOnCriticalError;
        }

        public boolean isRequeueOnError() {
            return requeueOnError;
        }

        public void setRequeueOnError(boolean requeueOnError) {
            this.requeueOnError = requeueOnError;
        }

        public boolean isThrowExceptions() {
            return throwExceptions;
        }

        public void setThrowExceptions(boolean throwExceptions) {
            this.throwExceptions = throwExceptions;
        }

        public boolean isAutoAck() {
            return autoAck;
        }

        public void setAutoAck(boolean autoAck) {
            this.autoAck = autoAck;
        }
    }

    public static class Publisher {
        private int batchSize = 100;
        private boolean confirmSelect;
        private Duration confirmTimeout = Duration.ofSeconds(5);

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public boolean isConfirmSelect() {
            return confirmSelect;
        }

        public void setConfirmSelect(boolean confirmSelect) {
            this.confirmSelect = confirmSelect;
        }

        public Duration getConfirmTimeout() {
            return confirmTimeout;
        }

        public void setConfirmTimeout(Duration confirmTimeout) {
            this.confirmTimeout = confirmTimeout;
        }
    }

    public static class Serialization {
        /**
         * Default format for published messages: json or msgpack.
         */
        private String format = "json";

        public String getFormat() {
            return format;
        }

        public void setFormat(String format) {
            this.format = format;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "burrow";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }

    public static class Queue {
        /**
         * Queue name on the broker. Defaults to the map key.
         */
        private String name;
        private List<String> bindingKeys = new ArrayList<>();
        private boolean durable = true;
        private boolean autoDelete;
        private Map<String, Object> arguments = new LinkedHashMap<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getBindingKeys() {
            return bindingKeys;
        }

        public void setBindingKeys(List<String> bindingKeys) {
            this.bindingKeys = bindingKeys;
        }

        public boolean isDurable() {
            return durable;
        }

        public void setDurable(boolean durable) {
            this.durable = durable;
        }

        public boolean isAutoDelete() {
            return autoDelete;
        }

        public void setAutoDelete(boolean autoDelete) {
            this.autoDelete = autoDelete;
        }

        public Map<String, Object> getArguments() {
            return arguments;
        }

        public void setArguments(Map<String, Object> arguments) {
            this.arguments = arguments;
        }
    }
}
