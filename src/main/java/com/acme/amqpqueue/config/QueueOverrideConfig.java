package com.acme.amqpqueue.config;

import io.micronaut.context.annotation.EachProperty;
import io.micronaut.context.annotation.Parameter;

/**
 * Queue options for one logical queue, configured as {@code rabbitmq.overrides.queue_<name>.*}.
 */
@EachProperty("rabbitmq.overrides")
public class QueueOverrideConfig extends QueueOptions {

    private final String key;

    public QueueOverrideConfig(@Parameter String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
