package com.intteq.rabbit.wire.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.rabbit.wire.RabbitWireProperties;
import com.rabbitmq.client.SocketConfigurators;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.ReturnedMessage;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory.CacheMode;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocket;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Set;

/**
 * RabbitMQ connection, template and admin built from {@code rabbit-wire.transport.*}.
 *
 * <p>When {@code use-ssl=true} the connection only negotiates TLSv1.3 or TLSv1.2, with the
 * JVM's default trust store and host name verification.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class RabbitWireTransportConfig {

    static final Set<String> ALLOWED_TLS_PROTOCOLS = Set.of("TLSv1.3", "TLSv1.2");

    @Bean
    @ConditionalOnMissingBean(ConnectionFactory.class)
    public ConnectionFactory connectionFactory(RabbitWireProperties properties) {
        RabbitWireProperties.Transport transport = properties.getTransport();
        CachingConnectionFactory factory = new CachingConnectionFactory();

        factory.setHost(transport.getHost());
        factory.setPort(transport.getPort());
        factory.setVirtualHost(transport.getVirtualHost());
        factory.setUsername(transport.getUser());
        factory.setPassword(transport.getPass());

        factory.setConnectionTimeout(10_000);
        factory.setRequestedHeartBeat(60);

        factory.setCacheMode(CacheMode.CHANNEL);
        factory.setChannelCacheSize(50);
        factory.setChannelCheckoutTimeout(10_000);

        // Publisher confirms back the send futures
        factory.setPublisherConfirmType(CachingConnectionFactory.ConfirmType.CORRELATED);
        factory.setPublisherReturns(true);

        if (transport.isUseSsl()) {
            enableTls(factory.getRabbitConnectionFactory());
            log.info("RabbitMQ TLS enabled (protocols={})", ALLOWED_TLS_PROTOCOLS);
        }

        log.info("RabbitMQ ConnectionFactory initialized: host={} port={} vhost={}",
                transport.getHost(), transport.getPort(), transport.getVirtualHost());

        return factory;
    }

    @Bean
    @ConditionalOnMissingBean(MessageConverter.class)
    public MessageConverter messageConverter(@Nullable ObjectMapper objectMapper) {
        ObjectMapper mapper = objectMapper != null ? objectMapper : new ObjectMapper();
        Jackson2JsonMessageConverter json = new Jackson2JsonMessageConverter(mapper);
        json.setCreateMessageIds(true);
        return json;
    }

    /**
     * Mandatory publishing template. Sends made through the gateway carry {@link CorrelationData}
     * and are reported there; the callbacks below only cover the other publishes.
     */
    @Bean
    @ConditionalOnMissingBean(RabbitTemplate.class)
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory, MessageConverter messageConverter) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setMessageConverter(messageConverter);
        template.setMandatory(true);
        template.setConfirmCallback(RabbitWireTransportConfig::onUncorrelatedConfirm);
        template.setReturnsCallback(RabbitWireTransportConfig::onReturned);
        return template;
    }

    static void onUncorrelatedConfirm(@Nullable CorrelationData correlation, boolean ack, @Nullable String cause) {
        if (correlation == null && !ack) {
            log.warn("Broker rejected a publish sent without correlation data: {}", cause);
        }
    }

    static void onReturned(ReturnedMessage returned) {
        log.debug("Unroutable publish returned: messageId={} replyCode={} exchange='{}' routingKey='{}'",
                returned.getMessage().getMessageProperties().getMessageId(),
                returned.getReplyCode(),
                returned.getExchange(),
                returned.getRoutingKey());
    }

    @Bean
    @ConditionalOnMissingBean(AmqpAdmin.class)
    public AmqpAdmin amqpAdmin(ConnectionFactory connectionFactory) {
        return new RabbitAdmin(connectionFactory);
    }

    static void enableTls(com.rabbitmq.client.ConnectionFactory rabbitFactory) {
        try {
            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, null, null);
            rabbitFactory.useSslProtocol(sslContext);
        } catch (NoSuchAlgorithmException | KeyManagementException e) {
            throw new IllegalStateException("Unable to initialize TLS for RabbitMQ", e);
        }

        rabbitFactory.setSocketConfigurator(SocketConfigurators.defaultConfigurator().andThen(socket -> {
            if (socket instanceof SSLSocket sslSocket) {
                sslSocket.setEnabledProtocols(allowedProtocols(sslSocket.getSupportedProtocols()));
            }
        }));
        // must follow setSocketConfigurator, it extends the configurator set there
        rabbitFactory.enableHostnameVerification();
    }

    static String[] allowedProtocols(String[] supported) {
        String[] allowed = Arrays.stream(supported)
                .filter(ALLOWED_TLS_PROTOCOLS::contains)
                .toArray(String[]::new);
        if (allowed.length == 0) {
            throw new IllegalStateException("JVM supports neither TLSv1.3 nor TLSv1.2: " + Arrays.toString(supported));
        }
        return allowed;
    }
}
