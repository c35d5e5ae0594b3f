package com.acme.amqpqueue.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

final class Delays {

    private Delays() {
    }

    static long secondsUntil(Duration delay) {
        return delay == null ? 0 : Math.max(0, delay.toSeconds());
    }

    static long secondsUntil(Instant availableAt, Clock clock) {
        if (availableAt == null) {
            return 0;
        }
        return Math.max(0, availableAt.getEpochSecond() - clock.instant().getEpochSecond());
    }
}
