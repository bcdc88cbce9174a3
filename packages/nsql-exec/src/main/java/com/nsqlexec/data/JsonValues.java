package com.nsqlexec.data;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Conversions between Gson trees and the plain values the engine works with: null, String,
 * BigDecimal, Boolean and lists of those.
 */
final class JsonValues {

    private JsonValues() {
    }

    static Object toJava(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonArray()) {
            List<Object> values = new ArrayList<>();
            for (JsonElement item : element.getAsJsonArray()) {
                values.add(toJava(item));
            }
            return values;
        }
        if (element.isJsonObject()) {
            return element.toString();
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        if (primitive.isNumber()) {
            try {
                return primitive.getAsBigDecimal();
            } catch (NumberFormatException e) {
                return primitive.getAsString();
            }
        }
        return primitive.getAsString();
    }

    /** An array as a list; a single value as a one-element list; null as an empty list. */
    static List<Object> toList(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return Collections.emptyList();
        }
        Object value = toJava(element);
        if (value instanceof List) {
            @SuppressWarnings("unchecked")
            List<Object> list = (List<Object>) value;
            return list;
        }
        return Collections.singletonList(value);
    }

    static List<String> toStrings(JsonElement element) {
        List<String> strings = new ArrayList<>();
        for (Object value : toList(element)) {
            strings.add(value == null ? null : value.toString());
        }
        return strings;
    }

    static JsonElement toJson(Object value) {
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        if (value instanceof Boolean) {
            return new JsonPrimitive((Boolean) value);
        }
        if (value instanceof BigDecimal) {
            return new JsonPrimitive((BigDecimal) value);
        }
        if (value instanceof Number) {
            return new JsonPrimitive((Number) value);
        }
        if (value instanceof Collection) {
            JsonArray array = new JsonArray();
            for (Object item : (Collection<?>) value) {
                array.add(toJson(item));
            }
            return array;
        }
        return new JsonPrimitive(value.toString());
    }

    static String getString(JsonObject object, String member) {
        JsonElement element = object.get(member);
        return element == null || element.isJsonNull() ? null : element.getAsString();
    }
}
