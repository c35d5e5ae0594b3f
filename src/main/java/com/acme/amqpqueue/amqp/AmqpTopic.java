package com.acme.amqpqueue.amqp;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Exchange descriptor. Identity is the exchange name.
 */
public final class AmqpTopic {

    public static final String TYPE_DIRECT = "direct";
    public static final String TYPE_FANOUT = "fanout";
    public static final String TYPE_TOPIC = "topic";
    public static final String TYPE_HEADERS = "headers";

    public enum Flag {
        PASSIVE,
        DURABLE,
        AUTO_DELETE
    }

    private final String name;
    private String type = TYPE_DIRECT;
    private final EnumSet<Flag> flags = EnumSet.noneOf(Flag.class);
    private final Map<String, Object> arguments = new LinkedHashMap<>();

    public AmqpTopic(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
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

    /**
     * Two descriptors declare the same exchange when type, flags and arguments match.
     */
    public boolean sameDeclarationAs(AmqpTopic other) {
        return other != null
            && name.equals(other.name)
            && Objects.equals(type, other.type)
            && flags.equals(other.flags)
            && arguments.equals(other.arguments);
    }

    @Override
    public String toString() {
        return "AmqpTopic{name=" + name + ", type=" + type + ", flags=" + flags + ", arguments=" + arguments + "}";
    }
}
