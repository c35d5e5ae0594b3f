package com.acme.amqpqueue.core;

/**
 * Raised instead of backing off when {@code sleep-on-error} is disabled.
 */
public class QueueConnectionException extends RuntimeException {

    public QueueConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
