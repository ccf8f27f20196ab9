package org.pragmatica.json.error;

/**
 * Thrown when a failed parse result is unwrapped.
 */
public final class JsonParseException extends RuntimeException {
    private final ParseError error;

    public JsonParseException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }
}
