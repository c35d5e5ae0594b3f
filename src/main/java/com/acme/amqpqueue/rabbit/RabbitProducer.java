package com.acme.amqpqueue.rabbit;

import com.acme.amqpqueue.amqp.AmqpMessage;
import com.acme.amqpqueue.amqp.AmqpProducer;
import com.acme.amqpqueue.amqp.AmqpTopic;
import com.acme.amqpqueue.amqp.BrokerException;

class RabbitProducer implements AmqpProducer {
    private final RabbitAmqpContext context;
    private final DelayStrategy delayStrategy;
    private Long deliveryDelay;

    RabbitProducer(RabbitAmqpContext context, DelayStrategy delayStrategy) {
        this.context = context;
        this.delayStrategy = delayStrategy;
    }

    @Override
    public AmqpProducer setDeliveryDelay(Long deliveryDelay) {
        this.deliveryDelay = deliveryDelay;
        return this;
    }

    @Override
    public Long getDeliveryDelay() {
        return deliveryDelay;
    }

    @Override
    public void send(AmqpTopic topic, AmqpMessage message) throws BrokerException {
        if (deliveryDelay != null && deliveryDelay > 0) {
            delayStrategy.delayMessage(context, topic, message, deliveryDelay);
            return;
        }
        context.publish(topic.getName(), message.getRoutingKey(), message);
    }
}
