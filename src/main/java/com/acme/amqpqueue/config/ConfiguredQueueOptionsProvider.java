package com.acme.amqpqueue.config;

import com.acme.amqpqueue.spi.QueueOptionsProvider;
import io.micronaut.core.naming.NameUtils;
import jakarta.inject.Singleton;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Overrides from {@code rabbitmq.overrides.*}. Micronaut hyphenates property names, so
 * {@code queue_emails} arrives as {@code queue-emails}; keys are compared in that form.
 */
@Singleton
public class ConfiguredQueueOptionsProvider implements QueueOptionsProvider {

    private final Map<String, QueueOptions> overrides = new HashMap<>();

    public ConfiguredQueueOptionsProvider(List<QueueOverrideConfig> configs) {
        for (QueueOverrideConfig c : configs) {
            overrides.put(normalize(c.getKey()), c);
        }
    }

    @Override
    public Optional<QueueOptions> queueOptions(String queueName) {
        return Optional.ofNullable(overrides.get(normalize(QueueOptionsProvider.overrideKey(queueName))));
    }

    private static String normalize(String key) {
        return NameUtils.hyphenate(key);
    }
}
