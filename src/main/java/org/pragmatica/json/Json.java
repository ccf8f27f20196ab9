package org.pragmatica.json;

import org.pragmatica.json.tree.JsonRenderer;
import org.pragmatica.json.tree.JsonValue;

/**
 * Static shortcuts for the standard parser and renderer.
 */
public final class Json {
    private Json() {}

    public static Result<JsonValue> parse(String text) {
        return JsonParser.standard()
                         .parse(text);
    }

    /**
     * Compact JSON text for {@code value}.
     */
    public static String render(JsonValue value) {
        return JsonRenderer.render(value);
    }
}
