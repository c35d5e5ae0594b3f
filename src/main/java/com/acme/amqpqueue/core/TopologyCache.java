package com.acme.amqpqueue.core;

import com.acme.amqpqueue.amqp.AmqpQueue;
import com.acme.amqpqueue.amqp.AmqpTopic;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Exchanges and queues already declared on the live connection. A name is only added after the
 * broker accepted its declare. Not thread-safe.
 */
public class TopologyCache {
    private final Map<String, AmqpTopic> exchanges = new HashMap<>();
    private final Map<String, AmqpQueue> queues = new HashMap<>();

    public boolean isExchangeDeclared(String name) {
        return exchanges.containsKey(name);
    }

    public void markExchangeDeclared(AmqpTopic topic) {
        exchanges.put(topic.getName(), topic);
    }

    public Optional<AmqpTopic> declaredExchange(String name) {
        return Optional.ofNullable(exchanges.get(name));
    }

    public boolean isQueueDeclared(String name) {
        return queues.containsKey(name);
    }

    public void markQueueDeclared(AmqpQueue queue) {
        queues.put(queue.getQueueName(), queue);
    }

    public Optional<AmqpQueue> declaredQueue(String name) {
        return Optional.ofNullable(queues.get(name));
    }

    public void clear() {
        exchanges.clear();
        queues.clear();
    }
}
