package com.acme.amqpqueue.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;

public final class Jsons {
    private static final ObjectMapper M = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

    private Jsons() {
    }

    public static String toJson(Object o) {
        try {
            return M.writeValueAsString(o);
        } catch (Exception e) {
            throw new IllegalArgumentException("Cannot serialize " + o.getClass().getName() + " to JSON", e);
        }
    }

    public static JsonNode toTree(Object o) {
        return M.valueToTree(o);
    }

    public static Map<String, Object> toMap(String json) {
        try {
            return M.readValue(json, MAP);
        } catch (Exception e) {
            throw new IllegalArgumentException("Payload is not a JSON object", e);
        }
    }
}
