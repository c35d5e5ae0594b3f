package com.acme.amqpqueue.rabbit;

import com.acme.amqpqueue.amqp.AmqpMessage;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.GetResponse;
import com.rabbitmq.client.LongString;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps between {@link AmqpMessage} and the RabbitMQ client's properties and responses.
 */
public final class Mappers {

    private Mappers() {
    }

    public static AMQP.BasicProperties toBasicProperties(AmqpMessage message) {
        var builder = new AMQP.BasicProperties.Builder()
            .contentType(message.getContentType())
            .contentEncoding(message.getContentEncoding())
            .deliveryMode(message.getDeliveryMode())
            .priority(message.getPriority())
            .correlationId(message.getCorrelationId())
            .expiration(message.getExpiration());

        Map<String, Object> table = new HashMap<>(message.getProperties());
        for (var e : message.getHeaders().entrySet()) {
            Object v = e.getValue();
            switch (e.getKey()) {
                case "reply_to" -> builder.replyTo(text(v));
                case "message_id" -> builder.messageId(text(v));
                case "type" -> builder.type(text(v));
                case "app_id" -> builder.appId(text(v));
                case "user_id" -> builder.userId(text(v));
                case "cluster_id" -> builder.clusterId(text(v));
                case "timestamp" -> builder.timestamp(toDate(v));
                // anything else travels as an application header
                default -> table.put(e.getKey(), v);
            }
        }
        if (!table.isEmpty()) {
            builder.headers(table);
        }
        return builder.build();
    }

    public static AmqpMessage toMessage(GetResponse response) {
        var props = response.getProps();
        var envelope = response.getEnvelope();
        var message = new AmqpMessage(response.getBody());

        message.setDeliveryTag(envelope.getDeliveryTag());
        message.setRoutingKey(envelope.getRoutingKey());
        message.setRedelivered(envelope.isRedeliver());

        if (props != null) {
            message.setCorrelationId(props.getCorrelationId());
            message.setContentType(props.getContentType());
            message.setContentEncoding(props.getContentEncoding());
            message.setDeliveryMode(props.getDeliveryMode());
            message.setPriority(props.getPriority());
            message.setExpiration(props.getExpiration());

            Map<String, Object> headers = new LinkedHashMap<>();
            putIfPresent(headers, "reply_to", props.getReplyTo());
            putIfPresent(headers, "message_id", props.getMessageId());
            putIfPresent(headers, "type", props.getType());
            putIfPresent(headers, "app_id", props.getAppId());
            putIfPresent(headers, "user_id", props.getUserId());
            putIfPresent(headers, "cluster_id", props.getClusterId());
            if (props.getTimestamp() != null) {
                headers.put("timestamp", props.getTimestamp().getTime() / 1000);
            }
            message.setHeaders(headers);

            if (props.getHeaders() != null) {
                Map<String, Object> properties = new LinkedHashMap<>();
                props.getHeaders().forEach((k, v) -> properties.put(k, normalise(v)));
                message.setProperties(properties);
            }
        }
        return message;
    }

    private static Object normalise(Object value) {
        if (value instanceof LongString) {
            return value.toString();
        }
        if (value instanceof List) {
            return ((List<?>) value).stream().map(Mappers::normalise).collect(Collectors.toList());
        }
        return value;
    }

    private static String text(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static Date toDate(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Date) {
            return (Date) value;
        }
        if (value instanceof Number) {
            return new Date(((Number) value).longValue() * 1000);
        }
        return new Date(Long.parseLong(String.valueOf(value)) * 1000);
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
