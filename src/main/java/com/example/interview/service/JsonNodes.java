package com.example.interview.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Null-safe readers for loosely typed model output.
 */
public final class JsonNodes {

    private JsonNodes() {
    }

    /** Trimmed text of a field; {@code ""} when missing or null. Non-text values are rendered as JSON. */
    public static String text(JsonNode node, String field) {
        if (node == null) return "";
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || v.isMissingNode()) return "";
        return v.isValueNode() ? v.asText("").trim() : v.toString();
    }

    /** Non-blank trimmed strings of an array field; a plain string becomes a one-element list. */
    public static List<String> strings(JsonNode node, String field) {
        List<String> out = new ArrayList<>();
        if (node == null) return out;
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return out;
        if (v.isArray()) {
            for (JsonNode item : v) {
                String s = item.isValueNode() ? item.asText("").trim() : item.toString();
                if (!s.isEmpty()) out.add(s);
            }
        } else if (v.isValueNode() && !v.asText("").isBlank()) {
            out.add(v.asText().trim());
        }
        return out;
    }

    /** Integer value of a number or numeric string, rounded; {@code fallback} otherwise. */
    public static int intValue(JsonNode v, int fallback) {
        if (v == null || v.isNull()) return fallback;
        if (v.isNumber()) return (int) Math.round(v.asDouble());
        if (v.isTextual()) {
            try {
                return (int) Math.round(Double.parseDouble(v.asText().trim()));
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    public static boolean bool(JsonNode node, String field) {
        if (node == null) return false;
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return false;
        if (v.isBoolean()) return v.asBoolean();
        return "true".equalsIgnoreCase(v.asText("").trim());
    }
}
