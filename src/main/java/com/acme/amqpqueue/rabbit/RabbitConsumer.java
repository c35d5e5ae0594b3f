package com.acme.amqpqueue.rabbit;

import com.acme.amqpqueue.amqp.AmqpConsumer;
import com.acme.amqpqueue.amqp.AmqpMessage;
import com.acme.amqpqueue.amqp.AmqpQueue;
import com.acme.amqpqueue.amqp.BrokerException;
import java.util.Optional;

/**
 * Polls with basic.get and manual acknowledgement.
 */
class RabbitConsumer implements AmqpConsumer {
    private final RabbitAmqpContext context;
    private final AmqpQueue queue;

    RabbitConsumer(RabbitAmqpContext context, AmqpQueue queue) {
        this.context = context;
        this.queue = queue;
    }

    @Override
    public AmqpQueue getQueue() {
        return queue;
    }

    @Override
    public Optional<AmqpMessage> receiveNoWait() throws BrokerException {
        return context.get(queue.getQueueName());
    }

    @Override
    public void acknowledge(AmqpMessage message) throws BrokerException {
        context.ack(requireTag(message));
    }

    @Override
    public void reject(AmqpMessage message, boolean requeue) throws BrokerException {
        context.reject(requireTag(message), requeue);
    }

    private static long requireTag(AmqpMessage message) {
        if (message.getDeliveryTag() == null) {
            throw new IllegalArgumentException("Message has no delivery tag; it was not received from a queue");
        }
        return message.getDeliveryTag();
    }
}
