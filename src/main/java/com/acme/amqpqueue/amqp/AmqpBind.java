package com.acme.amqpqueue.amqp;

/**
 * Binds a queue to an exchange under a routing key.
 */
public record AmqpBind(AmqpQueue queue, AmqpTopic topic, String routingKey) {}
