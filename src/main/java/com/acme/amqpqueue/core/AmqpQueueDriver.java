package com.acme.amqpqueue.core;

import com.acme.amqpqueue.amqp.AmqpConsumer;
import com.acme.amqpqueue.amqp.AmqpContext;
import com.acme.amqpqueue.amqp.AmqpMessage;
import com.acme.amqpqueue.amqp.AmqpProducer;
import com.acme.amqpqueue.amqp.BrokerException;
import com.acme.amqpqueue.config.QueueConnectionConfig;
import com.acme.amqpqueue.spi.DeliveryOptions;
import com.acme.amqpqueue.spi.Job;
import com.acme.amqpqueue.spi.QueueDriver;
import com.acme.amqpqueue.spi.QueueOptionsProvider;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * {@link QueueDriver} on top of an AMQP context.
 *
 * <p>Broker errors never reach the caller: they go through {@link ConnectionErrorHandler} and the
 * operation returns an empty result, unless the handler escalates. Topology conflicts are not
 * broker errors and propagate as {@link TopologyConflictException}.</p>
 *
 * <p>One instance holds one connection and is meant for a single consumer loop or request
 * context at a time.</p>
 */
public class AmqpQueueDriver implements QueueDriver {

    private final AmqpContext context;
    private final TopologyResolver resolver;
    private final MessageBuilder messages;
    private final ConnectionErrorHandler errors;
    private final Clock clock;
    private String correlationId;

    public AmqpQueueDriver(AmqpContext context, QueueConnectionConfig config, QueueOptionsProvider overrides) {
        this(context,
            new TopologyResolver(context, new TopologyCache(), config.getDefaultQueue(),
                config.getExchange(), config.getQueue(), overrides),
            new MessageBuilder(context),
            new ConnectionErrorHandler(config.getErrorBackoff(), Sleeper.THREAD),
            Clock.systemUTC());
    }

    public AmqpQueueDriver(AmqpContext context, TopologyResolver resolver, MessageBuilder messages,
                           ConnectionErrorHandler errors, Clock clock) {
        this.context = context;
        this.resolver = resolver;
        this.messages = messages;
        this.errors = errors;
        this.clock = clock;
    }

    @Override
    public int size(String queue) {
        try {
            var topology = resolver.resolve(queue);
            return context.declareQueue(topology.queue());
        } catch (BrokerException e) {
            errors.report("size", e);
            return 0;
        }
    }

    @Override
    public Optional<String> push(Object job, Object data, String queue) {
        return pushRaw(Payloads.createPayload(job, data), queue, DeliveryOptions.none());
    }

    @Override
    public Optional<String> pushRaw(String payload, String queue, DeliveryOptions options) {
        DeliveryOptions o = options == null ? DeliveryOptions.none() : options;
        try {
            var topology = resolver.resolve(queue);
            AmqpMessage message = messages.build(payload, topology.queue(), o, correlationId);

            AmqpProducer producer = context.createProducer();
            if (o.hasDelay()) {
                producer.setDeliveryDelay(o.delay() * 1000);
            }
            producer.send(topology.topic(), message);

            return Optional.of(message.getCorrelationId());
        } catch (BrokerException e) {
            errors.report("pushRaw", e);
            return Optional.empty();
        }
    }

    @Override
    public Optional<String> later(Duration delay, Object job, Object data, String queue) {
        return laterSeconds(Delays.secondsUntil(delay), job, data, queue);
    }

    @Override
    public Optional<String> later(Instant availableAt, Object job, Object data, String queue) {
        return laterSeconds(Delays.secondsUntil(availableAt, clock), job, data, queue);
    }

    @Override
    public Optional<String> release(Duration delay, Object job, Object data, String queue, int attempts) {
        return releaseSeconds(Delays.secondsUntil(delay), job, data, queue, attempts);
    }

    @Override
    public Optional<String> release(Instant availableAt, Object job, Object data, String queue, int attempts) {
        return releaseSeconds(Delays.secondsUntil(availableAt, clock), job, data, queue, attempts);
    }

    @Override
    public Optional<Job> pop(String queue) {
        try {
            var topology = resolver.resolve(queue);
            AmqpConsumer consumer = context.createConsumer(topology.queue());
            Optional<AmqpMessage> message = consumer.receiveNoWait();
            if (message.isPresent()) {
                return Optional.of(new AmqpJob(this, consumer, message.get(), topology.queue().getQueueName()));
            }
        } catch (BrokerException e) {
            errors.report("pop", e);
        }
        return Optional.empty();
    }

    /**
     * The id the next send will carry: the one set through {@link #setCorrelationId}, or a fresh one.
     */
    public String getCorrelationId() {
        return messages.correlationIdFor(correlationId);
    }

    public void setCorrelationId(String id) {
        this.correlationId = id;
    }

    public AmqpContext getContext() {
        return context;
    }

    void reportConnectionError(String action, BrokerException e) {
        errors.report(action, e);
    }

    private Optional<String> laterSeconds(long delay, Object job, Object data, String queue) {
        return pushRaw(Payloads.createPayload(job, data), queue, DeliveryOptions.builder().delay(delay).build());
    }

    private Optional<String> releaseSeconds(long delay, Object job, Object data, String queue, int attempts) {
        return pushRaw(Payloads.createPayload(job, data), queue,
            DeliveryOptions.builder().delay(delay).attempts(attempts).build());
    }
}
