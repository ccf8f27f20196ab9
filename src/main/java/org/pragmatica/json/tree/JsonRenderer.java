package org.pragmatica.json.tree;

import org.pragmatica.json.tree.JsonValue.JsonArray;
import org.pragmatica.json.tree.JsonValue.JsonBool;
import org.pragmatica.json.tree.JsonValue.JsonNull;
import org.pragmatica.json.tree.JsonValue.JsonNumber;
import org.pragmatica.json.tree.JsonValue.JsonObject;
import org.pragmatica.json.tree.JsonValue.JsonString;

/**
 * Compact JSON text for a {@link JsonValue}.
 *
 * <p>Integral numbers below 1e15 are written without a fraction, other finite numbers
 * as {@link Double#toString(double)} does, and NaN or infinities as {@code null}.
 * Strings escape quotes, backslashes and control characters; everything else is
 * written as is.
 */
public final class JsonRenderer {
    private static final double INTEGRAL_LIMIT = 1e15;

    private JsonRenderer() {}

    public static String render(JsonValue value) {
        var sb = new StringBuilder();
        render(value, sb);
        return sb.toString();
    }

    private static void render(JsonValue value, StringBuilder sb) {
        if (value instanceof JsonNull) {
            sb.append("null");
        } else if (value instanceof JsonBool bool) {
            sb.append(bool.value());
        } else if (value instanceof JsonNumber number) {
            renderNumber(number.value(), sb);
        } else if (value instanceof JsonString string) {
            renderString(string.value(), sb);
        } else if (value instanceof JsonArray array) {
            sb.append('[');
            var first = true;
            for (var element : array.elements()) {
                if (!first) {
                    sb.append(',');
                }
                render(element, sb);
                first = false;
            }
            sb.append(']');
        } else if (value instanceof JsonObject object) {
            sb.append('{');
            var first = true;
            for (var member : object.members().entrySet()) {
                if (!first) {
                    sb.append(',');
                }
                renderString(member.getKey(), sb);
                sb.append(':');
                render(member.getValue(), sb);
                first = false;
            }
            sb.append('}');
        }
    }

    private static void renderNumber(double value, StringBuilder sb) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            sb.append("null");
        } else if (value == Math.rint(value) && Math.abs(value) < INTEGRAL_LIMIT && !isNegativeZero(value)) {
            sb.append((long) value);
        } else {
            sb.append(value);
        }
    }

    private static boolean isNegativeZero(double value) {
        return Double.doubleToRawLongBits(value) == Double.doubleToRawLongBits(-0.0);
    }

    private static void renderString(String value, StringBuilder sb) {
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }
}
