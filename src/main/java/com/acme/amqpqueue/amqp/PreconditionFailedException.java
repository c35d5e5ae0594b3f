package com.acme.amqpqueue.amqp;

/**
 * The broker refused a declare because the entity already exists with other flags or arguments
 * (AMQP reply code 406).
 */
public class PreconditionFailedException extends BrokerException {

    public PreconditionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
