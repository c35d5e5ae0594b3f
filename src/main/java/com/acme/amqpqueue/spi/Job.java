package com.acme.amqpqueue.spi;

import java.util.Map;

/**
 * A job taken off a queue. The holder decides whether it is deleted, released or failed.
 */
public interface Job {

    String getJobId();

    String getRawBody();

    Map<String, Object> payload();

    String getName();

    String getQueue();

    /**
     * Number of times this job has been handed out, including the current one.
     */
    int attempts();

    void delete();

    void release(long delaySeconds);

    void fail();

    boolean isDeleted();

    boolean isReleased();
}
