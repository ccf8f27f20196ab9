package org.pragmatica.json;

import org.junit.jupiter.api.Test;
import org.pragmatica.json.error.JsonParseException;
import org.pragmatica.json.error.ParseError;
import org.pragmatica.json.tree.JsonValue;
import org.pragmatica.json.tree.JsonValue.JsonArray;
import org.pragmatica.json.tree.JsonValue.JsonBool;
import org.pragmatica.json.tree.JsonValue.JsonNull;
import org.pragmatica.json.tree.JsonValue.JsonNumber;
import org.pragmatica.json.tree.JsonValue.JsonObject;
import org.pragmatica.json.tree.JsonValue.JsonString;
import org.pragmatica.json.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for parsing complete JSON texts.
 */
class JsonParserTest {

    private final JsonParser parser = JsonParser.standard();

    // === Literals ===

    @Test
    void parse_literals() {
        assertEquals(JsonNull.INSTANCE, parse("null"));
        assertEquals(JsonBool.TRUE, parse("true"));
        assertEquals(JsonBool.FALSE, parse("false"));
    }

    @Test
    void parse_partialLiteral_failsAtStart() {
        var error = error("tru");

        var unexpected = assertInstanceOf(ParseError.UnexpectedInput.class, error);
        assertEquals(0, unexpected.offset());
        assertEquals("t", unexpected.found());
        assertTrue(unexpected.expected().contains("'true'"));
    }

    // === Numbers ===

    @Test
    void parse_numbers() {
        assertEquals(new JsonNumber(42), parse("42"));
        assertEquals(new JsonNumber(-50), parse("-0.5e2"));
        assertEquals(new JsonNumber(3.14), parse("3.14"));
        assertEquals(new JsonNumber(1000), parse("1e3"));
        assertEquals(new JsonNumber(-0.0), parse("-0"));
    }

    @Test
    void parse_hugeExponent_isInfinite() {
        var number = parse("1e400").asNumber().orElseThrow();

        assertTrue(Double.isInfinite(number));
    }

    @Test
    void parse_leadingZeros_lenientByDefault() {
        assertEquals(new JsonNumber(1), parse("01"));
    }

    @Test
    void parse_leadingZeros_rejectedWhenStrict() {
        var strict = JsonParser.builder()
                               .strictNumbers(true)
                               .build();

        var error = strict.parse("01").error().orElseThrow();

        var trailing = assertInstanceOf(ParseError.TrailingInput.class, error);
        assertEquals(1, trailing.offset());
        assertEquals("1", trailing.found());
        assertEquals(new JsonNumber(0), strict.parse("0").unwrap());
        assertEquals(new JsonNumber(10), strict.parse("10").unwrap());
    }

    // === Containers ===

    @Test
    void parse_array() {
        assertEquals(JsonArray.of(new JsonNumber(1), new JsonNumber(2)), parse("[1,2]"));
        assertEquals(JsonArray.of(), parse("[]"));
    }

    @Test
    void parse_arrayTrailingComma_fails() {
        var error = error("[1,2,]");

        var unexpected = assertInstanceOf(ParseError.UnexpectedInput.class, error);
        assertEquals(5, unexpected.offset());
        assertEquals("]", unexpected.found());
    }

    @Test
    void parse_arrayMissingComma_reportsBothOptions() {
        var error = error("[1 2]");

        assertEquals(3, error.offset());
        assertEquals("',' or ']'", error.expected());
        assertEquals("Unexpected '2' at 1:4, expected ',' or ']'", error.message());
    }

    @Test
    void parse_object() {
        var value = parse("{\"name\": \"json\", \"tags\": [true, null]}");

        assertEquals(new JsonString("json"), value.get("name").orElseThrow());
        assertEquals(JsonArray.of(JsonBool.TRUE, JsonNull.INSTANCE), value.get("tags").orElseThrow());
    }

    @Test
    void parse_duplicateKeys_lastValueWins() {
        var object = (JsonObject) parse("{\"a\":1,\"b\":2,\"a\":3}");

        assertEquals(2, object.size());
        assertEquals(new JsonNumber(3), object.get("a").orElseThrow());
        assertEquals(List.of("a", "b"), List.copyOf(object.members().keySet()));
    }

    @Test
    void parse_isWhitespaceInsensitive() {
        var spaced = """
             {
               "a" : [ 1 ,	2 ] ,
               "b" : { }
             }
            """;

        assertEquals(parse("{\"a\":[1,2],\"b\":{}}"), parse(spaced));
        assertEquals(parse("\r\n\t[\r\n]\r\n"), parse("[]"));
    }

    // === Strings ===

    @Test
    void parse_stringEscapes() {
        assertEquals(new JsonString("tab\there \"q\" é"), parse("\"tab\\there \\\"q\\\" \\u00e9\""));
    }

    @Test
    void parse_unterminatedString_isUnexpectedEof() {
        var error = error("\"ab");

        var eof = assertInstanceOf(ParseError.UnexpectedEof.class, error);
        assertEquals(3, eof.offset());
        assertEquals("'\"'", eof.expected());
    }

    @Test
    void parse_invalidEscape_fails() {
        var error = error("\"\\x\"");

        var unexpected = assertInstanceOf(ParseError.UnexpectedInput.class, error);
        assertEquals(2, unexpected.offset());
        assertEquals("x", unexpected.found());
        assertEquals("escape character", unexpected.expected());
    }

    @Test
    void parse_rawControlCharacterInString_fails() {
        var error = error("\"a\u0001\"");

        var unexpected = assertInstanceOf(ParseError.UnexpectedInput.class, error);
        assertEquals(2, unexpected.offset());
        assertEquals("\\u0001", unexpected.found());
    }

    // === Whole Input ===

    @Test
    void parse_trailingInput_fails() {
        var error = error("123abc");

        var trailing = assertInstanceOf(ParseError.TrailingInput.class, error);
        assertEquals(3, trailing.offset());
        assertEquals("end of input", trailing.expected());
        assertEquals("Unexpected 'a' at 1:4, expected end of input", trailing.message());
    }

    @Test
    void parse_secondValue_isTrailingInput() {
        assertInstanceOf(ParseError.TrailingInput.class, error("{} {}"));
    }

    @Test
    void parse_emptyAndBlankInput_areUnexpectedEof() {
        assertEquals(0, assertInstanceOf(ParseError.UnexpectedEof.class, error("")).offset());
        assertEquals(3, assertInstanceOf(ParseError.UnexpectedEof.class, error("   ")).offset());
    }

    @Test
    void parse_nullText_throws() {
        assertThrows(NullPointerException.class, () -> parser.parse(null));
    }

    @Test
    void parse_errorLocation_hasLineAndColumn() {
        var error = error("{\n  \"a\": tru\n}");

        assertEquals(SourceLocation.at(2, 8, 9), error.location());
    }

    @Test
    void unwrap_failure_throwsWithError() {
        var exception = assertThrows(JsonParseException.class, () -> parser.parse("[").unwrap());

        assertInstanceOf(ParseError.UnexpectedEof.class, exception.error());
        assertEquals(exception.error().message(), exception.getMessage());
    }

    // === Nesting ===

    @Test
    void parse_deeplyNestedArrays_onSmallStack() throws Exception {
        var depth = 1000;
        var text = "[".repeat(depth) + "1" + "]".repeat(depth);

        var value = onSmallStack(() -> parse(text));

        for (int i = 0; i < depth; i++) {
            value = value.get(0).orElseThrow();
        }
        assertEquals(new JsonNumber(1), value);
    }

    @Test
    void parse_deeplyNestedObjects_onSmallStack() throws Exception {
        var depth = 1000;
        var text = "{\"a\": ".repeat(depth) + "1" + "}".repeat(depth);

        var value = onSmallStack(() -> parse(text));

        for (int i = 0; i < depth; i++) {
            value = value.get("a").orElseThrow();
        }
        assertEquals(new JsonNumber(1), value);
    }

    @Test
    void parse_unboundedNesting_returnsErrorInsteadOfThrowing() throws Exception {
        var text = "[".repeat(100_000);

        var result = onSmallStack(() -> parser.parse(text));

        var error = assertInstanceOf(ParseError.UnexpectedInput.class, result.error().orElseThrow());
        assertEquals("less deeply nested value", error.expected());
        assertEquals("[", error.found());
        assertTrue(error.offset() > 0 && error.offset() < text.length());
    }

    @Test
    void parse_maxDepth_rejectsDeeperDocuments() {
        var limited = JsonParser.builder()
                                .maxDepth(2)
                                .build();

        assertTrue(limited.parse("[[1]]").isSuccess());
        assertTrue(limited.parse("{\"a\":[1]}").isSuccess());

        var error = limited.parse("[[[1]]]").error().orElseThrow();
        assertEquals(3, error.offset());
        assertEquals("nesting depth of at most 2", error.expected());
    }

    @Test
    void builder_invalidDepth_throws() {
        assertThrows(IllegalArgumentException.class, () -> JsonParser.builder().maxDepth(0).build());
    }

    // === Concurrency ===

    @Test
    void parse_sharedParserAcrossThreads() throws Exception {
        var documents = List.of("{\"a\":[1,2,{\"b\":null}]}", "[true,false,\"x\"]", "-12.5e1", "[1 2]");
        var expected = new ArrayList<Result<JsonValue>>();
        for (var document : documents) {
            expected.add(parser.parse(document));
        }

        var executor = Executors.newFixedThreadPool(8);
        try {
            var tasks = new ArrayList<Callable<Boolean>>();
            for (int i = 0; i < 200; i++) {
                var index = i % documents.size();
                tasks.add(() -> parser.parse(documents.get(index)).equals(expected.get(index)));
            }
            for (var future : executor.invokeAll(tasks)) {
                assertTrue(future.get());
            }
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }
    }

    // Runs on a thread with a 1 MiB stack, smaller than most JVM defaults
    private static <T> T onSmallStack(Callable<T> task) throws Exception {
        var future = new FutureTask<>(task);
        var thread = new Thread(null, future, "json-parser-small-stack", 1 << 20);
        thread.start();
        return future.get(30, TimeUnit.SECONDS);
    }

    private JsonValue parse(String text) {
        return parser.parse(text)
                     .fold(error -> fail("expected success for " + text + " but got " + error.message()),
                           value -> value);
    }

    private ParseError error(String text) {
        return parser.parse(text)
                     .error()
                     .orElseThrow(() -> new AssertionError("expected failure for " + text));
    }
}
