package org.pragmatica.json.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed JSON value - an immutable tree.
 *
 * <p>{@code toString()} renders compact JSON text that parses back to an equal value
 * (for numbers that are finite).
 */
public sealed interface JsonValue {

    default boolean isNull() {
        return false;
    }

    default Optional<Boolean> asBoolean() {
        return Optional.empty();
    }

    default Optional<Double> asNumber() {
        return Optional.empty();
    }

    default Optional<String> asString() {
        return Optional.empty();
    }

    /**
     * Element at {@code index} of an array.
     */
    default Optional<JsonValue> get(int index) {
        return Optional.empty();
    }

    /**
     * Member named {@code key} of an object.
     */
    default Optional<JsonValue> get(String key) {
        return Optional.empty();
    }

    // === Leaves ===

    record JsonNull() implements JsonValue {
        public static final JsonNull INSTANCE = new JsonNull();

        @Override
        public boolean isNull() {
            return true;
        }

        @Override
        public String toString() {
            return JsonRenderer.render(this);
        }
    }

    record JsonBool(boolean value) implements JsonValue {
        public static final JsonBool TRUE = new JsonBool(true);
        public static final JsonBool FALSE = new JsonBool(false);

        public static JsonBool of(boolean value) {
            return value ? TRUE : FALSE;
        }

        @Override
        public Optional<Boolean> asBoolean() {
            return Optional.of(value);
        }

        @Override
        public String toString() {
            return JsonRenderer.render(this);
        }
    }

    record JsonNumber(double value) implements JsonValue {
        @Override
        public Optional<Double> asNumber() {
            return Optional.of(value);
        }

        @Override
        public String toString() {
            return JsonRenderer.render(this);
        }
    }

    record JsonString(String value) implements JsonValue {
        public JsonString {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Optional<String> asString() {
            return Optional.of(value);
        }

        @Override
        public String toString() {
            return JsonRenderer.render(this);
        }
    }

    // === Containers ===

    record JsonArray(List<JsonValue> elements) implements JsonValue {
        public JsonArray {
            elements = List.copyOf(elements);
        }

        public static JsonArray of(JsonValue... elements) {
            return new JsonArray(List.of(elements));
        }

        public int size() {
            return elements.size();
        }

        @Override
        public Optional<JsonValue> get(int index) {
            return index >= 0 && index < elements.size()
                   ? Optional.of(elements.get(index))
                   : Optional.empty();
        }

        @Override
        public String toString() {
            return JsonRenderer.render(this);
        }
    }

    /**
     * Object members in the order their keys first appeared.
     */
    record JsonObject(Map<String, JsonValue> members) implements JsonValue {
        public JsonObject {
            members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
        }

        /**
         * Build from members in source order. A repeated key keeps its first position
         * and takes the value of its last occurrence.
         */
        public static JsonObject fromMembers(List<Map.Entry<String, JsonValue>> members) {
            var map = new LinkedHashMap<String, JsonValue>();
            for (var member : members) {
                map.put(member.getKey(), member.getValue());
            }
            return new JsonObject(map);
        }

        public int size() {
            return members.size();
        }

        @Override
        public Optional<JsonValue> get(String key) {
            return Optional.ofNullable(members.get(key));
        }

        @Override
        public String toString() {
            return JsonRenderer.render(this);
        }
    }
}
