package com.acme.amqpqueue.spi;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Transport-neutral queue contract used by the job framework.
 *
 * <p>A {@code null} queue name means the driver's default queue. Sending operations return the
 * id of the sent message, or empty when the broker could not be reached.</p>
 */
public interface QueueDriver {

    int size(String queue);

    Optional<String> push(Object job, Object data, String queue);

    Optional<String> pushRaw(String payload, String queue, DeliveryOptions options);

    Optional<String> later(Duration delay, Object job, Object data, String queue);

    Optional<String> later(Instant availableAt, Object job, Object data, String queue);

    /**
     * Puts a job back for another try, carrying its attempt count.
     */
    Optional<String> release(Duration delay, Object job, Object data, String queue, int attempts);

    Optional<String> release(Instant availableAt, Object job, Object data, String queue, int attempts);

    /**
     * Takes the next job if one is ready. Never waits for one.
     */
    Optional<Job> pop(String queue);

    default Optional<String> push(Object job) {
        return push(job, "", null);
    }

    default Optional<Job> pop() {
        return pop(null);
    }

    default int size() {
        return size(null);
    }
}
