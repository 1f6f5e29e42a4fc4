package com.intteq.rabbit.wire.internal;

import com.intteq.rabbit.wire.RabbitWireProperties;
import com.intteq.rabbit.wire.WireConsumer;
import com.intteq.rabbit.wire.endpoint.EndpointBinder;
import com.intteq.rabbit.wire.endpoint.EndpointRegistrar;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;

import java.util.List;

/**
 * Registers every {@link WireConsumer} bean once all singletons exist, so the
 * connection factory and admin are available to the binder.
 */
@Slf4j
@RequiredArgsConstructor
public class EndpointRegistrationInitializer implements SmartInitializingSingleton {

    private final EndpointRegistrar registrar;
    private final RabbitWireProperties properties;
    private final List<WireConsumer<?>> consumers;
    private final EndpointBinder binder;

    @Override
    public void afterSingletonsInstantiated() {
        if (!properties.isAutoStartup()) {
            log.info("rabbit-wire.auto-startup=false → {} consumer(s) left unbound", consumers.size());
            return;
        }

        log.info("Registering {} consumer endpoint(s)...", consumers.size());
        registrar.register(consumers, properties, binder);
    }
}
