package io.burrow.spring.boot;

import io.burrow.MessagingService;
import io.burrow.QueueDefinition;
import io.burrow.connection.ConnectionManager;
import io.burrow.connection.ConnectionSettings;
import io.burrow.connection.ExchangeSettings;
import io.burrow.connection.TlsSettings;
import io.burrow.consume.Consumer;
import io.burrow.consume.ConsumerSettings;
import io.burrow.publish.Publisher;
import io.burrow.rabbitmq.RabbitTransport;
import io.burrow.resilience.CircuitBreaker;
import io.burrow.resilience.RetryPolicy;
import io.burrow.serialization.SerializationFormat;
import io.burrow.spi.AmqpTransport;
import io.burrow.spi.ExchangeType;
import io.burrow.spi.MetricsExporter;
import io.burrow.validation.MessageValidator;
import io.burrow.validation.SimpleMessageValidator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Auto-configuration for burrow messaging.
 *
 * <p>Wires a {@link MessagingService} over a RabbitMQ {@link AmqpTransport} from
 * {@link BurrowProperties}. Every bean backs off when the application defines its own.
 * Connections are opened lazily, on first use.
 *
 * @see BurrowProperties
 * @see BurrowMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(MessagingService.class)
@EnableConfigurationProperties(BurrowProperties.class)
public class BurrowAutoConfiguration {

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");

    @Bean
    @ConditionalOnMissingBean
    public AmqpTransport amqpTransport() {
        return new RabbitTransport();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ConnectionManager connectionManager(AmqpTransport transport, BurrowProperties props) {
        return ConnectionManager.builder()
                .transport(transport)
                .settings(connectionSettings(props.getConnection()))
                .exchange(exchangeSettings(props.getExchange()))
                .debug(props.isDebug())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public Publisher publisher(ConnectionManager connectionManager, BurrowProperties props) {
        return Publisher.builder(connectionManager)
                .serializationFormat(SerializationFormat.of(props.getSerialization().getFormat()))
                .confirmSelect(props.getPublisher().isConfirmSelect())
                .confirmTimeout(props.getPublisher().getConfirmTimeout())
                .debug(props.isDebug())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public Consumer consumer(ConnectionManager connectionManager, BurrowProperties props,
                             ObjectProvider<MetricsExporter> metricsProvider) {
        BurrowProperties.Consumer c = props.getConsumer();
        ConsumerSettings settings = ConsumerSettings.builder()
                .prefetchCount(c.getPrefetchCount())
                .waitTimeout(c.getWaitTimeout())
                .reconnectDelay(c.getReconnectDelay())
                .reconnectMaxRetries(c.getReconnectMaxRetries())
                .stopOnCriticalError(c.isStopOnCriticalError())
                .requeueOnError(c.isRequeueOnError())
                .throwExceptions(c.isThrowExceptions())
                .autoAck(c.isAutoAck())
                .build();
        return Consumer.builder(connectionManager)
                .settings(settings)
                .metrics(metricsProvider.getIfAvailable())
                .debug(props.isDebug())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(BurrowProperties props, ObjectProvider<MetricsExporter> metricsProvider) {
        BurrowProperties.Resilience r = props.getResilience();
        return RetryPolicy.builder()
                .maxAttempts(r.getMaxAttempts())
                .baseDelayMs(r.getBaseDelayMs())
                .maxDelayMs(r.getMaxDelayMs())
                .jitterFactor(r.getJitterFactor())
                .metrics(metricsProvider.getIfAvailable())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public CircuitBreaker circuitBreaker(BurrowProperties props, ObjectProvider<MetricsExporter> metricsProvider) {
        return CircuitBreaker.builder(MessagingService.PUBLISHER_CIRCUIT)
                .failureThreshold(props.getResilience().getFailureThreshold())
                .resetTimeout(props.getResilience().getResetTimeout())
                .metrics(metricsProvider.getIfAvailable())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageValidator messageValidator() {
        return new SimpleMessageValidator();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public MessagingService messagingService(BurrowProperties props,
                                             ConnectionManager connectionManager,
                                             Publisher publisher,
                                             Consumer consumer,
                                             RetryPolicy retryPolicy,
                                             CircuitBreaker circuitBreaker,
                                             MessageValidator validator,
                                             ObjectProvider<MetricsExporter> metricsProvider) {
        MessagingService.Builder builder = MessagingService.builder()
                .connectionManager(connectionManager)
                .publisher(publisher)
                .consumer(consumer)
                .retryPolicy(retryPolicy)
                .circuitBreaker(circuitBreaker)
                .validator(validator)
                .metrics(metricsProvider.getIfAvailable())
                .serializationFormat(SerializationFormat.of(props.getSerialization().getFormat()))
                .batchSize(props.getPublisher().getBatchSize())
                .debug(props.isDebug());
        props.getQueues().forEach((key, queue) -> builder.queue(key, queueDefinition(key, queue)));
        return builder.build();
    }

    static ConnectionSettings connectionSettings(BurrowProperties.Connection c) {
        BurrowProperties.Ssl ssl = c.getSsl();
        return ConnectionSettings.builder()
                .host(c.getHost())
                .port(c.getPort())
                .username(c.getUser())
                .password(c.getPassword())
                .virtualHost(c.getVhost())
                .heartbeat(c.getHeartbeat())
                .connectionTimeout(c.getConnectionTimeout())
                .readWriteTimeout(c.getReadWriteTimeout())
                .keepalive(c.isKeepalive())
                .connectionName(c.getName())
                .tls(ssl.isEnabled()
                        ? new TlsSettings(true, ssl.isVerifyPeer(), caFile(ssl.getCaFile()))
                        : TlsSettings.DISABLED)
                .build();
    }

    private static Path caFile(String location) {
        return location == null || location.isBlank() ? null : Path.of(location);
    }

    static ExchangeSettings exchangeSettings(BurrowProperties.Exchange e) {
        return new ExchangeSettings(e.getName(), ExchangeType.of(e.getType()), e.isPassive(),
                e.isDurable(), e.isAutoDelete(), e.isInternal());
    }

    static QueueDefinition queueDefinition(String key, BurrowProperties.Queue queue) {
        String name = queue.getName() == null || queue.getName().isEmpty() ? key : queue.getName();
        Map<String, Object> arguments = new LinkedHashMap<>();
        queue.getArguments().forEach((argument, value) -> arguments.put(argument, argumentValue(value)));
        return new QueueDefinition(name, queue.getBindingKeys(), queue.isDurable(), queue.isAutoDelete(), arguments);
    }

    // Property sources bind everything as strings; the broker expects numbers and booleans.
    private static Object argumentValue(Object value) {
        if (!(value instanceof String text)) {
            return value;
        }
        if (INTEGER.matcher(text).matches()) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                // out of range for a long, pass it through as written
                return text;
            }
        }
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.parseBoolean(text);
        }
        return text;
    }
}
