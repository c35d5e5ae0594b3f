package com.acme.amqpqueue.amqp;

public interface AmqpProducer {

    /**
     * Defers visibility of the next sent messages by the given number of milliseconds.
     * {@code null} or zero sends immediately.
     */
    AmqpProducer setDeliveryDelay(Long deliveryDelay);

    Long getDeliveryDelay();

    void send(AmqpTopic topic, AmqpMessage message) throws BrokerException;
}
