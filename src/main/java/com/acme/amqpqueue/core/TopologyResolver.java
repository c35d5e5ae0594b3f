package com.acme.amqpqueue.core;

import com.acme.amqpqueue.amqp.AmqpBind;
import com.acme.amqpqueue.amqp.AmqpContext;
import com.acme.amqpqueue.amqp.AmqpQueue;
import com.acme.amqpqueue.amqp.AmqpTopic;
import com.acme.amqpqueue.amqp.BrokerException;
import com.acme.amqpqueue.amqp.PreconditionFailedException;
import com.acme.amqpqueue.config.ExchangeOptions;
import com.acme.amqpqueue.config.QueueOptions;
import com.acme.amqpqueue.spi.QueueOptionsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the exchange and queue behind a queue name and declares them once per connection.
 *
 * <p>Each queue gets an exchange of its own name unless one is configured. Queue options can be
 * overridden per queue through {@link QueueOptionsProvider}. A name already in the
 * {@link TopologyCache} is not declared again, even when its options have changed since.</p>
 */
public class TopologyResolver {
    private static final Logger LOG = LoggerFactory.getLogger(TopologyResolver.class);

    private final AmqpContext context;
    private final TopologyCache cache;
    private final String defaultQueue;
    private final ExchangeOptions exchangeOptions;
    private final QueueOptions queueOptions;
    private final QueueOptionsProvider overrides;

    public TopologyResolver(AmqpContext context, TopologyCache cache, String defaultQueue,
                            ExchangeOptions exchangeOptions, QueueOptions queueOptions,
                            QueueOptionsProvider overrides) {
        this.context = context;
        this.cache = cache;
        this.defaultQueue = defaultQueue;
        this.exchangeOptions = exchangeOptions;
        this.queueOptions = queueOptions;
        this.overrides = overrides;
        context.addConnectionListener(cache::clear);
    }

    public ResolvedTopology resolve(String queueName) throws BrokerException {
        String name = queueName(queueName);
        String exchangeName = isBlank(exchangeOptions.getName()) ? name : exchangeOptions.getName();

        AmqpTopic topic = context.createTopic(exchangeName);
        topic.setType(exchangeOptions.getType());
        topic.setArguments(exchangeOptions.getArguments());
        if (exchangeOptions.isPassive()) {
            topic.addFlag(AmqpTopic.Flag.PASSIVE);
        }
        if (exchangeOptions.isDurable()) {
            topic.addFlag(AmqpTopic.Flag.DURABLE);
        }
        if (exchangeOptions.isAutoDelete()) {
            topic.addFlag(AmqpTopic.Flag.AUTO_DELETE);
        }

        if (exchangeOptions.isDeclare()) {
            if (!cache.isExchangeDeclared(exchangeName)) {
                try {
                    context.declareTopic(topic);
                } catch (PreconditionFailedException e) {
                    throw new TopologyConflictException("Exchange declared with different arguments.", e);
                }
                cache.markExchangeDeclared(topic);
                LOG.debug("Declared exchange {}", topic);
            } else if (!topic.sameDeclarationAs(cache.declaredExchange(exchangeName).orElse(null))) {
                LOG.warn("Exchange {} was declared earlier on this connection with other options, keeping those", exchangeName);
            }
        }

        AmqpQueue queue = context.createQueue(name);
        QueueOptions options = overrides.queueOptions(name).orElse(queueOptions);

        queue.setArguments(options.getArguments());
        if (options.isPassive()) {
            queue.addFlag(AmqpQueue.Flag.PASSIVE);
        }
        if (options.isDurable()) {
            queue.addFlag(AmqpQueue.Flag.DURABLE);
        }
        if (options.isExclusive()) {
            queue.addFlag(AmqpQueue.Flag.EXCLUSIVE);
        }
        if (options.isAutoDelete()) {
            queue.addFlag(AmqpQueue.Flag.AUTO_DELETE);
        }

        if (options.isDeclare()) {
            if (!cache.isQueueDeclared(name)) {
                try {
                    context.declareQueue(queue);
                } catch (PreconditionFailedException e) {
                    throw new TopologyConflictException("Queue declared with different arguments.", e);
                }
                cache.markQueueDeclared(queue);
                LOG.debug("Declared queue {}", queue);
            } else if (!queue.sameDeclarationAs(cache.declaredQueue(name).orElse(null))) {
                LOG.warn("Queue {} was declared earlier on this connection with other options, keeping those", name);
            }
        }

        if (options.isBind()) {
            context.bind(new AmqpBind(queue, topic, queue.getQueueName()));
        }

        return new ResolvedTopology(queue, topic);
    }

    public String queueName(String queueName) {
        return isBlank(queueName) ? defaultQueue : queueName;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public record ResolvedTopology(AmqpQueue queue, AmqpTopic topic) {}
}
