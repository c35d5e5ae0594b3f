package com.acme.amqpqueue.rabbit;

import com.acme.amqpqueue.amqp.AmqpMessage;
import com.acme.amqpqueue.amqp.AmqpQueue;
import com.acme.amqpqueue.amqp.AmqpTopic;
import com.acme.amqpqueue.amqp.BrokerException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parks the message in a per-delay queue whose TTL dead-letters it into the target exchange under
 * its original routing key. Works on any RabbitMQ without plugins. Each delay queue is declared
 * once per connection.
 */
public class DlxDelayStrategy implements DelayStrategy {

    static final String SUFFIX = ".x.delay";

    private final Set<String> declared = ConcurrentHashMap.newKeySet();

    @Override
    public void delayMessage(RabbitAmqpContext context, AmqpTopic topic, AmqpMessage message, long delayMillis)
        throws BrokerException {
        String routingKey = message.getRoutingKey() == null ? "" : message.getRoutingKey();
        String name = delayQueueName(topic.getName(), routingKey, delayMillis);

        if (!declared.contains(name)) {
            AmqpQueue delayQueue = context.createQueue(name);
            delayQueue.addFlag(AmqpQueue.Flag.DURABLE);
            delayQueue.setArguments(Map.of(
                "x-message-ttl", delayMillis,
                "x-dead-letter-exchange", topic.getName(),
                "x-dead-letter-routing-key", routingKey
            ));
            context.declareQueue(delayQueue);
            declared.add(name);
        }

        context.publish("", name, message);
    }

    @Override
    public void connectionRecreated() {
        declared.clear();
    }

    static String delayQueueName(String exchange, String routingKey, long delayMillis) {
        return exchange + "." + routingKey + "." + delayMillis + SUFFIX;
    }
}
