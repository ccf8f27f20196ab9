package org.pragmatica.json;

import org.junit.jupiter.api.Test;
import org.pragmatica.json.error.JsonParseException;
import org.pragmatica.json.error.ParseError;
import org.pragmatica.json.tree.SourceLocation;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ResultTest {

    private static final ParseError ERROR = new ParseError.UnexpectedEof(SourceLocation.at(1, 2, 1), "digit");

    @Test
    void success_mapAndFlatMap() {
        var result = Result.success(2)
                           .map(n -> n * 3)
                           .flatMap(n -> Result.success("v" + n));

        assertEquals(Result.success("v6"), result);
        assertEquals("v6", result.unwrap());
        assertTrue(result.error().isEmpty());
    }

    @Test
    void success_fold_appliesSuccessBranch() {
        assertEquals("ok 1", Result.success(1).fold(error -> "failed", value -> "ok " + value));
    }

    @Test
    void success_rejectsNull() {
        assertThrows(NullPointerException.class, () -> Result.success(null));
    }

    @Test
    void failure_skipsMapping() {
        Result<Integer> failure = Result.failure(ERROR);

        var mapped = failure.map(n -> n + 1)
                            .flatMap(n -> Result.success(n.toString()));

        assertTrue(mapped.isFailure());
        assertSame(ERROR, mapped.error().orElseThrow());
        assertEquals("failed", mapped.fold(error -> "failed", value -> value));
    }

    @Test
    void failure_unwrap_throws() {
        var exception = assertThrows(JsonParseException.class, () -> Result.failure(ERROR).unwrap());

        assertSame(ERROR, exception.error());
        assertEquals("Unexpected end of input at 1:2, expected digit", exception.getMessage());
    }

    @Test
    void callbacks_runForMatchingVariantOnly() {
        var seen = new AtomicReference<String>("none");

        Result.success("v")
              .onFailure(error -> seen.set("failure"))
              .onSuccess(seen::set);
        assertEquals("v", seen.get());

        Result.<String>failure(ERROR)
              .onSuccess(seen::set)
              .onFailure(error -> seen.set(error.expected()));
        assertEquals("digit", seen.get());
    }
}
