package com.acme.amqpqueue.amqp;

/**
 * Notified when a context replaces its broker connection. Anything cached per connection is stale
 * from that point on.
 */
@FunctionalInterface
public interface ConnectionListener {
    void connectionRecreated();
}
