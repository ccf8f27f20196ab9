package org.pragmatica.json;

import org.pragmatica.json.error.ParseError;
import org.pragmatica.json.grammar.JsonGrammar;
import org.pragmatica.json.grammar.ParserConfig;
import org.pragmatica.json.parser.Cursor;
import org.pragmatica.json.parser.Expectation;
import org.pragmatica.json.parser.ParseResult;
import org.pragmatica.json.tree.JsonValue;
import org.pragmatica.json.tree.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Parses complete JSON texts.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = JsonParser.builder()
 *                        .maxDepth(64)
 *                        .build();
 *
 * parser.parse("{\"a\": [1, 2]}")
 *       .onSuccess(value -> System.out.println(value.get("a")))
 *       .onFailure(error -> System.err.println(error.message()));
 * }</pre>
 *
 * <p>Parsers are immutable; one instance can serve any number of threads.
 */
public final class JsonParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonParser.class);

    private static final JsonParser STANDARD = new JsonParser(JsonGrammar.standard());

    private final JsonGrammar grammar;

    private JsonParser(JsonGrammar grammar) {
        this.grammar = grammar;
    }

    /**
     * Parser with {@link ParserConfig#DEFAULT} settings.
     */
    public static JsonParser standard() {
        return STANDARD;
    }

    public static JsonParser create(ParserConfig config) {
        return new JsonParser(JsonGrammar.create(config));
    }

    public static Builder builder() {
        return new Builder();
    }

    public ParserConfig config() {
        return grammar.config();
    }

    /**
     * Parse {@code text} as a single JSON value, optionally surrounded by whitespace.
     */
    public Result<JsonValue> parse(String text) {
        Objects.requireNonNull(text, "text");

        var result = grammar.value()
                            .parse(Cursor.of(text));

        if (result instanceof ParseResult.Failure<JsonValue> failure) {
            return fail(text, toError(text, failure.expected()));
        }

        var success = (ParseResult.Success<JsonValue>) result;
        var remaining = success.remaining();

        // Check if we consumed all input
        if (!remaining.isAtEnd()) {
            return fail(text, new ParseError.TrailingInput(remaining.location(), describe(remaining.peek().getAsInt())));
        }

        LOGGER.trace("Parsed {} characters", text.length());
        return Result.success(success.value());
    }

    private static Result<JsonValue> fail(String text, ParseError error) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Rejected JSON text of {} characters: {}", text.length(), error.message());
        }
        return Result.failure(error);
    }

    private static ParseError toError(String text, Expectation expected) {
        var offset = expected.offset();
        var location = SourceLocation.locate(text, offset);
        if (offset >= text.length()) {
            return new ParseError.UnexpectedEof(location, expected.describe());
        }
        return new ParseError.UnexpectedInput(location, describe(text.codePointAt(offset)), expected.describe());
    }

    private static String describe(int codePoint) {
        return codePoint < 0x20
               ? String.format("\\u%04x", codePoint)
               : new String(Character.toChars(codePoint));
    }

    public static final class Builder {
        private int maxDepth = ParserConfig.UNLIMITED_DEPTH;
        private boolean strictNumbers = false;

        private Builder() {}

        /**
         * Maximum number of nested arrays and objects.
         */
        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        /**
         * Reject numbers with leading zeros such as {@code 01}.
         */
        public Builder strictNumbers(boolean strict) {
            this.strictNumbers = strict;
            return this;
        }

        public JsonParser build() {
            return create(new ParserConfig(maxDepth, strictNumbers));
        }
    }
}
