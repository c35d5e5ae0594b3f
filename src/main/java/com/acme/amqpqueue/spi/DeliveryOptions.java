package com.acme.amqpqueue.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named delivery options for a raw push. Every field is optional; {@code delay} is in seconds.
 */
public record DeliveryOptions(
    Long delay,
    Integer attempts,
    String routingKey,
    Integer priority,
    String expiration,
    Long deliveryTag,
    String consumerTag,
    String contentEncoding,
    Map<String, Object> headers,
    Map<String, Object> properties
) {
    private static final DeliveryOptions NONE = builder().build();

    public static DeliveryOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .delay(delay)
            .attempts(attempts)
            .routingKey(routingKey)
            .priority(priority)
            .expiration(expiration)
            .deliveryTag(deliveryTag)
            .consumerTag(consumerTag)
            .contentEncoding(contentEncoding)
            .headers(headers)
            .properties(properties);
    }

    public boolean hasDelay() {
        return delay != null && delay > 0;
    }

    public static final class Builder {
        private Long delay;
        private Integer attempts;
        private String routingKey;
        private Integer priority;
        private String expiration;
        private Long deliveryTag;
        private String consumerTag;
        private String contentEncoding;
        private Map<String, Object> headers;
        private Map<String, Object> properties;

        private Builder() {
        }

        public Builder delay(Long seconds) {
            this.delay = seconds;
            return this;
        }

        public Builder attempts(Integer attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder routingKey(String routingKey) {
            this.routingKey = routingKey;
            return this;
        }

        public Builder priority(Integer priority) {
            this.priority = priority;
            return this;
        }

        public Builder expiration(String expiration) {
            this.expiration = expiration;
            return this;
        }

        public Builder deliveryTag(Long deliveryTag) {
            this.deliveryTag = deliveryTag;
            return this;
        }

        public Builder consumerTag(String consumerTag) {
            this.consumerTag = consumerTag;
            return this;
        }

        public Builder contentEncoding(String contentEncoding) {
            this.contentEncoding = contentEncoding;
            return this;
        }

        public Builder headers(Map<String, Object> headers) {
            this.headers = headers;
            return this;
        }

        public Builder properties(Map<String, Object> properties) {
            this.properties = properties;
            return this;
        }

        public DeliveryOptions build() {
            return new DeliveryOptions(delay, attempts, routingKey, priority, expiration, deliveryTag,
                consumerTag, contentEncoding,
                copy(headers), copy(properties));
        }

        // keeps null values, which AMQP tables allow
        private static Map<String, Object> copy(Map<String, Object> map) {
            return map == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(map));
        }
    }
}
