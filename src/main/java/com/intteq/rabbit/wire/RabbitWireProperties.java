package com.intteq.rabbit.wire;

import com.intteq.rabbit.wire.endpoint.ExchangeKind;
import com.intteq.rabbit.wire.retry.RetryPolicyBuilder;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for Rabbit Wire.
 *
 * <p>Prefix: {@code rabbit-wire.*}
 *
 * <p>Example:
 * <pre>
 * rabbit-wire.prefix=dev
 * rabbit-wire.transport.host=rabbit.internal
 * rabbit-wire.transport.virtual-host=/orders
 * rabbit-wire.transport.user=orders
 * rabbit-wire.transport.pass=secret
 * rabbit-wire.transport.use-ssl=true
 *
 * rabbit-wire.endpoint.prefetch-count=10
 * rabbit-wire.conventions[com.acme.OrderShipped]=dev.ordershipped.event.v1
 * </pre>
 *
 * <p>The broker connection settings are kept in {@link Transport}; this class only adds
 * what the naming conventions need on top of them. Invalid values fail startup.
 */
@Getter
@Setter
@Validated
@ToString
@ConfigurationProperties(prefix = "rabbit-wire")
public class RabbitWireProperties {

    /**
     * Environment tag every queue name starts with (e.g. "dev", "prod"). Used as is.
     */
    @NotBlank(message = "rabbit-wire.prefix must not be blank")
    private String prefix;

    /**
     * Whether consumer endpoints are bound once the application context is ready.
     */
    private boolean autoStartup = true;

    @Valid
    @NestedConfigurationProperty
    private Transport transport = new Transport();

    @Valid
    @NestedConfigurationProperty
    private EndpointDefaults endpoint = new EndpointDefaults();

    /**
     * Explicit send conventions: fully qualified message class name → address.
     * Take precedence over the conventions derived from registered consumers.
     */
    private Map<String, String> conventions = new LinkedHashMap<>();

    // ========================================================================
    // Transport
    // ========================================================================

    @Getter
    @Setter
    @ToString(exclude = "pass")
    public static class Transport {

        @NotBlank(message = "rabbit-wire.transport.host must not be blank")
        private String host = "localhost";

        @NotBlank(message = "rabbit-wire.transport.virtual-host must not be blank")
        private String virtualHost = "/";

        private String user = "guest";

        private String pass = "guest";

        @Min(1)
        @Max(65535)
        private int port = 5672;

        /** Negotiate TLS 1.2 or higher. */
        private boolean useSsl = false;
    }

    // ========================================================================
    // Endpoint defaults
    // ========================================================================

    /**
     * Attributes applied to every endpoint unless a consumer overrides them.
     */
    @Getter
    @Setter
    @ToString
    public static class EndpointDefaults {

        @Min(value = 1, message = "rabbit-wire.endpoint.prefetch-count must be positive")
        private int prefetchCount = 5;

        private boolean configureConsumeTopology = false;

        private boolean autoDelete = false;

        @NotNull
        private ExchangeKind exchangeKind = ExchangeKind.FANOUT;

        /** Attempts of the interval retry stage; 0 skips it. */
        @Min(0)
        private int retryLimit = RetryPolicyBuilder.DEFAULT_RETRY_LIMIT;

        @NotNull
        private Duration retryInterval = RetryPolicyBuilder.DEFAULT_INTERVAL;
    }
}
