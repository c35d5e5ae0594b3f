package com.acme.amqpqueue.amqp;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Queue descriptor. Identity is the queue name.
 */
public final class AmqpQueue {

    public enum Flag {
        PASSIVE,
        DURABLE,
        EXCLUSIVE,
        AUTO_DELETE
    }

    private final String queueName;
    private final EnumSet<Flag> flags = EnumSet.noneOf(Flag.class);
    private final Map<String, Object> arguments = new LinkedHashMap<>();

    public AmqpQueue(String queueName) {
        this.queueName = Objects.requireNonNull(queueName, "queueName");
    }

    public String getQueueName() {
        return queueName;
    }

    public void addFlag(Flag flag) {
        flags.add(flag);
    }

    public boolean hasFlag(Flag flag) {
        return flags.contains(flag);
    }

    public Set<Flag> getFlags() {
        return flags.clone();
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    public void setArguments(Map<String, ?> arguments) {
        this.arguments.clear();
        if (arguments != null) {
            this.arguments.putAll(arguments);
        }
    }

    public boolean sameDeclarationAs(AmqpQueue other) {
        return other != null
            && queueName.equals(other.queueName)
            && flags.equals(other.flags)
            && arguments.equals(other.arguments);
    }

    @Override
    public String toString() {
        return "AmqpQueue{name=" + queueName + ", flags=" + flags + ", arguments=" + arguments + "}";
    }
}
