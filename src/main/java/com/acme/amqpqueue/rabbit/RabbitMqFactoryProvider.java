package com.acme.amqpqueue.rabbit;

import com.acme.amqpqueue.amqp.AmqpContext;
import com.acme.amqpqueue.config.QueueConnectionConfig;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

@Requires(notEnv = "test")
@Factory
public class RabbitMqFactoryProvider {

    @Singleton
    @Bean(preDestroy = "close")
    public AmqpContext amqpContext(QueueConnectionConfig config, RabbitMqConnector connector) {
        return connector.connect(config);
    }
}
