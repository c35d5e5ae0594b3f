package com.acme.amqpqueue.config;

import java.time.Duration;
import java.util.Objects;

/**
 * What to do after a broker error: pause for a while, or escalate.
 * Parsed from {@code rabbitmq.sleep-on-error}, which takes a number of seconds or {@code false}.
 */
public final class ErrorBackoff {

    public static final Duration DEFAULT_SLEEP = Duration.ofSeconds(5);

    private final Duration sleep;

    private ErrorBackoff(Duration sleep) {
        this.sleep = sleep;
    }

    public static ErrorBackoff sleep(Duration duration) {
        Objects.requireNonNull(duration, "duration");
        if (duration.isNegative()) {
            throw new IllegalArgumentException("sleep-on-error must not be negative: " + duration);
        }
        return new ErrorBackoff(duration);
    }

    public static ErrorBackoff escalate() {
        return new ErrorBackoff(null);
    }

    public static ErrorBackoff parse(String value) {
        if (value == null || value.isBlank()) {
            return sleep(DEFAULT_SLEEP);
        }
        String v = value.trim();
        if ("false".equalsIgnoreCase(v)) {
            return escalate();
        }
        try {
            return sleep(Duration.ofSeconds(Long.parseLong(v)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("sleep-on-error must be a number of seconds or false, got: " + value, e);
        }
    }

    public boolean isEscalate() {
        return sleep == null;
    }

    public Duration getSleep() {
        return sleep;
    }

    @Override
    public String toString() {
        return isEscalate() ? "escalate" : "sleep " + sleep.toSeconds() + "s";
    }
}
