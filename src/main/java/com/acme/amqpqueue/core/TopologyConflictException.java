package com.acme.amqpqueue.core;

/**
 * An exchange or queue already exists on the broker with other flags or arguments.
 * Retrying does not help; the configuration has to change.
 */
public class TopologyConflictException extends RuntimeException {

    public TopologyConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
