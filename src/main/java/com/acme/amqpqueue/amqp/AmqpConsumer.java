package com.acme.amqpqueue.amqp;

import java.util.Optional;

public interface AmqpConsumer {

    AmqpQueue getQueue();

    /**
     * Returns the next pending message, or empty straight away when there is none.
     */
    Optional<AmqpMessage> receiveNoWait() throws BrokerException;

    void acknowledge(AmqpMessage message) throws BrokerException;

    void reject(AmqpMessage message, boolean requeue) throws BrokerException;
}
