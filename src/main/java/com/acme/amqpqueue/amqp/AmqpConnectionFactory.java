package com.acme.amqpqueue.amqp;

/**
 * Creates contexts for one broker. Implementations are chosen by class name from configuration
 * and must expose a public constructor taking {@code ConnectionSettings}.
 */
public interface AmqpConnectionFactory {
    AmqpContext createContext();
}
