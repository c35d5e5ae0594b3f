package com.acme.amqpqueue.core;

import com.acme.amqpqueue.amqp.AmqpConsumer;
import com.acme.amqpqueue.amqp.AmqpMessage;
import com.acme.amqpqueue.amqp.BrokerException;
import com.acme.amqpqueue.spi.DeliveryOptions;
import com.acme.amqpqueue.spi.Job;
import java.util.Map;
import java.util.Optional;

/**
 * A job received from a queue, bound to the consumer that received it.
 */
public class AmqpJob implements Job {

    private final AmqpQueueDriver driver;
    private final AmqpConsumer consumer;
    private final AmqpMessage message;
    private final String queue;
    private Map<String, Object> decoded;
    private boolean deleted;
    private boolean released;

    public AmqpJob(AmqpQueueDriver driver, AmqpConsumer consumer, AmqpMessage message, String queue) {
        this.driver = driver;
        this.consumer = consumer;
        this.message = message;
        this.queue = queue;
    }

    @Override
    public String getJobId() {
        return message.getCorrelationId();
    }

    @Override
    public String getRawBody() {
        return message.getBodyAsString();
    }

    @Override
    public Map<String, Object> payload() {
        if (decoded == null) {
            decoded = Jsons.toMap(getRawBody());
        }
        return decoded;
    }

    @Override
    public String getName() {
        Object job = payload().get("job");
        return job == null ? null : job.toString();
    }

    @Override
    public String getQueue() {
        return queue;
    }

    @Override
    public int attempts() {
        Object count = message.getProperty(MessageBuilder.ATTEMPT_COUNT_HEADER, 0);
        return toInt(count) + 1;
    }

    @Override
    public void delete() {
        try {
            consumer.acknowledge(message);
            deleted = true;
        } catch (BrokerException e) {
            driver.reportConnectionError("delete", e);
        }
    }

    /**
     * Republishes the raw body with the current attempt count, then acknowledges this delivery.
     * If the republish fails the delivery stays unacknowledged and the broker hands it out again.
     */
    @Override
    public void release(long delaySeconds) {
        Optional<String> id = driver.pushRaw(getRawBody(), queue,
            DeliveryOptions.builder().delay(delaySeconds).attempts(attempts()).build());
        if (id.isEmpty()) {
            return;
        }
        released = true;
        delete();
    }

    @Override
    public void fail() {
        try {
            consumer.reject(message, false);
            deleted = true;
        } catch (BrokerException e) {
            driver.reportConnectionError("fail", e);
        }
    }

    @Override
    public boolean isDeleted() {
        return deleted;
    }

    @Override
    public boolean isReleased() {
        return released;
    }

    public AmqpMessage getMessage() {
        return message;
    }

    private static int toInt(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
