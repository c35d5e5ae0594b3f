package com.acme.amqpqueue.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the JSON payload of a job.
 *
 * <p>A {@code String} job names its handler and travels as-is with {@code data}. Any other object
 * is serialized under {@code data.command}, with its class name as {@code displayName}.</p>
 */
public final class Payloads {

    public static final int ID_LENGTH = 32;

    private Payloads() {
    }

    public static String createPayload(Object job, Object data) {
        return Jsons.toJson(createPayloadMap(job, data));
    }

    static Map<String, Object> createPayloadMap(Object job, Object data) {
        Objects.requireNonNull(job, "job");
        var payload = new LinkedHashMap<String, Object>();
        if (job instanceof String) {
            String name = (String) job;
            payload.put("displayName", displayName(name));
            payload.put("job", name);
            payload.put("data", data == null ? "" : data);
        } else {
            String className = job.getClass().getName();
            var command = new LinkedHashMap<String, Object>();
            command.put("commandName", className);
            command.put("command", Jsons.toTree(job));
            payload.put("displayName", className);
            payload.put("job", className);
            payload.put("data", command);
        }
        payload.put("id", RandomIds.random(ID_LENGTH));
        return payload;
    }

    // "Handler@method" displays as "Handler"
    private static String displayName(String job) {
        int at = job.indexOf('@');
        return at > 0 ? job.substring(0, at) : job;
    }
}
