package com.acme.amqpqueue.amqp;

/**
 * Declare, publish and consume primitives of one broker connection.
 *
 * <p>Every broker round-trip may fail with {@link BrokerException}. Declares that clash with an
 * existing entity fail with {@link PreconditionFailedException}.</p>
 */
public interface AmqpContext extends AutoCloseable {

    AmqpTopic createTopic(String name);

    AmqpQueue createQueue(String name);

    AmqpMessage createMessage(byte[] body);

    void declareTopic(AmqpTopic topic) throws BrokerException;

    /**
     * Declares the queue and returns the number of messages ready in it.
     */
    int declareQueue(AmqpQueue queue) throws BrokerException;

    void bind(AmqpBind bind) throws BrokerException;

    AmqpProducer createProducer();

    AmqpConsumer createConsumer(AmqpQueue queue);

    void addConnectionListener(ConnectionListener listener);

    @Override
    void close();
}
