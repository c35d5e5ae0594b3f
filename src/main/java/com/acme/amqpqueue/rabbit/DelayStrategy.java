package com.acme.amqpqueue.rabbit;

import com.acme.amqpqueue.amqp.AmqpMessage;
import com.acme.amqpqueue.amqp.AmqpTopic;
import com.acme.amqpqueue.amqp.BrokerException;
import com.acme.amqpqueue.amqp.ConnectionListener;

/**
 * How a message is held back by the broker before it reaches its exchange. The owning context
 * registers the strategy as a {@link ConnectionListener}.
 */
public interface DelayStrategy extends ConnectionListener {

    void delayMessage(RabbitAmqpContext context, AmqpTopic topic, AmqpMessage message, long delayMillis)
        throws BrokerException;

    @Override
    default void connectionRecreated() {
    }

    static DelayStrategy named(String name) {
        if (name == null || name.isBlank() || "dlx".equalsIgnoreCase(name)) {
            return new DlxDelayStrategy();
        }
        if ("delayed-exchange".equalsIgnoreCase(name)) {
            return new DelayedExchangeDelayStrategy();
        }
        throw new IllegalArgumentException("Unknown delay strategy: " + name + " (expected dlx or delayed-exchange)");
    }
}
