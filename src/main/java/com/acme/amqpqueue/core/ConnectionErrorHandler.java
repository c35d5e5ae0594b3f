package com.acme.amqpqueue.core;

import com.acme.amqpqueue.config.ErrorBackoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports broker errors, then either pauses to throttle the next attempt or escalates.
 */
public class ConnectionErrorHandler {
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionErrorHandler.class);

    private final ErrorBackoff backoff;
    private final Sleeper sleeper;

    public ConnectionErrorHandler(ErrorBackoff backoff, Sleeper sleeper) {
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    public void report(String action, Exception e) {
        LOG.error("AMQP error while attempting {}: {}", action, e.getMessage());

        if (backoff.isEscalate()) {
            throw new QueueConnectionException("Error writing data to the connection with RabbitMQ", e);
        }
        if (backoff.getSleep().isZero()) {
            return;
        }
        try {
            sleeper.sleep(backoff.getSleep());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new QueueConnectionException("Interrupted while backing off after AMQP error", ie);
        }
    }

    public ErrorBackoff getBackoff() {
        return backoff;
    }
}
