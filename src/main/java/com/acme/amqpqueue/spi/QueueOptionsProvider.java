package com.acme.amqpqueue.spi;

import com.acme.amqpqueue.config.QueueOptions;
import java.util.Optional;

/**
 * Per-queue option overrides, looked up under the key {@code queue_<name>}.
 */
public interface QueueOptionsProvider {

    Optional<QueueOptions> queueOptions(String queueName);

    static String overrideKey(String queueName) {
        return "queue_" + queueName;
    }

    static QueueOptionsProvider none() {
        return name -> Optional.empty();
    }
}
