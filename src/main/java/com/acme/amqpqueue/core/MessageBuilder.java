package com.acme.amqpqueue.core;

import com.acme.amqpqueue.amqp.AmqpContext;
import com.acme.amqpqueue.amqp.AmqpMessage;
import com.acme.amqpqueue.amqp.AmqpQueue;
import com.acme.amqpqueue.spi.DeliveryOptions;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Turns a payload and its delivery options into an outbound message. Option values are passed
 * through unchecked; the broker rejects bad ones.
 */
public class MessageBuilder {

    public static final String CONTENT_TYPE = "application/json";
    public static final String ATTEMPT_COUNT_HEADER = "attempts_count";

    private final AmqpContext context;
    private final Supplier<String> ids;

    public MessageBuilder(AmqpContext context) {
        this(context, () -> UUID.randomUUID().toString());
    }

    public MessageBuilder(AmqpContext context, Supplier<String> ids) {
        this.context = context;
        this.ids = ids;
    }

    public String correlationIdFor(String override) {
        return override != null && !override.isEmpty() ? override : ids.get();
    }

    public AmqpMessage build(String payload, AmqpQueue queue, DeliveryOptions options, String correlationId) {
        DeliveryOptions o = options == null ? DeliveryOptions.none() : options;
        AmqpMessage message = context.createMessage(payload.getBytes(StandardCharsets.UTF_8));

        message.setCorrelationId(correlationIdFor(correlationId));
        message.setContentType(CONTENT_TYPE);
        message.setDeliveryMode(AmqpMessage.DELIVERY_MODE_PERSISTENT);

        if (o.contentEncoding() != null) {
            message.setContentEncoding(o.contentEncoding());
        }
        message.setRoutingKey(o.routingKey() != null ? o.routingKey() : queue.getQueueName());
        if (o.priority() != null) {
            message.setPriority(o.priority());
        }
        if (o.expiration() != null) {
            message.setExpiration(o.expiration());
        }
        if (o.deliveryTag() != null) {
            message.setDeliveryTag(o.deliveryTag());
        }
        if (o.consumerTag() != null) {
            message.setConsumerTag(o.consumerTag());
        }
        if (o.headers() != null) {
            message.setHeaders(o.headers());
        }
        if (o.properties() != null) {
            message.setProperties(o.properties());
        }
        // after properties so a properties map cannot drop it
        if (o.attempts() != null) {
            message.setProperty(ATTEMPT_COUNT_HEADER, o.attempts());
        }
        return message;
    }
}
