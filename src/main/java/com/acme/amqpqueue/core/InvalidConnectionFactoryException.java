package com.acme.amqpqueue.core;

public class InvalidConnectionFactoryException extends RuntimeException {

    public InvalidConnectionFactoryException(String message) {
        super(message);
    }

    public InvalidConnectionFactoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
