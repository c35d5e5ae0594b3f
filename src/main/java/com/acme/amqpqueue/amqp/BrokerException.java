package com.acme.amqpqueue.amqp;

/**
 * Any failure talking to the broker: lost connection, closed channel, protocol error.
 * Callers treat it as recoverable.
 */
public class BrokerException extends Exception {

    public BrokerException(String message) {
        super(message);
    }

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
