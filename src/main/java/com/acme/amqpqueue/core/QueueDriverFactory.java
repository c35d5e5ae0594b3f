package com.acme.amqpqueue.core;

import com.acme.amqpqueue.amqp.AmqpContext;
import com.acme.amqpqueue.config.QueueConnectionConfig;
import com.acme.amqpqueue.spi.QueueOptionsProvider;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

@Factory
public class QueueDriverFactory {

    @Singleton
    public AmqpQueueDriver queueDriver(AmqpContext context, QueueConnectionConfig config, QueueOptionsProvider overrides) {
        return new AmqpQueueDriver(context, config, overrides);
    }
}
