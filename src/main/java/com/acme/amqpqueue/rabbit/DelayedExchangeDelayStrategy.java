package com.acme.amqpqueue.rabbit;

import com.acme.amqpqueue.amqp.AmqpMessage;
import com.acme.amqpqueue.amqp.AmqpTopic;
import com.acme.amqpqueue.amqp.BrokerException;

/**
 * Uses the rabbitmq_delayed_message_exchange plugin: the target exchange must be of type
 * {@code x-delayed-message} and holds the message for {@code x-delay} milliseconds.
 */
public class DelayedExchangeDelayStrategy implements DelayStrategy {

    static final String DELAY_HEADER = "x-delay";

    @Override
    public void delayMessage(RabbitAmqpContext context, AmqpTopic topic, AmqpMessage message, long delayMillis)
        throws BrokerException {
        message.setProperty(DELAY_HEADER, delayMillis);
        context.publish(topic.getName(), message.getRoutingKey(), message);
    }
}
