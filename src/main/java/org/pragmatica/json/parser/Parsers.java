package org.pragmatica.json.parser;

import org.pragmatica.json.parser.ParseResult.Failure;
import org.pragmatica.json.parser.ParseResult.Success;

import java.util.function.IntPredicate;
import java.util.function.Supplier;

/**
 * Primitive parsers over characters and literal text.
 *
 * <p>Every primitive either consumes input and succeeds, or fails without consuming
 * anything, which makes them safe building blocks for {@link Parser#many()}.
 */
public final class Parsers {
    private Parsers() {}

    /**
     * One code point satisfying {@code predicate}.
     */
    public static Parser<Integer> charMatching(IntPredicate predicate, String description) {
        return input -> {
            var next = input.peek();
            if (next.isEmpty() || !predicate.test(next.getAsInt())) {
                return Failure.at(input, description);
            }
            var codePoint = next.getAsInt();
            return input.advance(1)
                        .<ParseResult<Integer>>map(rest -> Success.of(codePoint, rest))
                        .orElseGet(() -> Failure.at(input, description));
        };
    }

    public static Parser<Integer> character(char expected) {
        return charMatching(c -> c == expected, "'" + expected + "'");
    }

    /**
     * Exactly {@code text}. Atomic: a partial match consumes nothing.
     */
    public static Parser<String> literal(String text) {
        var description = "'" + text + "'";
        return input -> input.skip(text)
                             .<ParseResult<String>>map(rest -> Success.of(text, rest))
                             .orElseGet(() -> Failure.at(input, description));
    }

    /**
     * Zero or more spaces, tabs, carriage returns and line feeds. Always succeeds, never
     * reports an expectation of its own.
     */
    public static Parser<String> whitespace() {
        return charMatching(Parsers::isWhitespace, "").many()
                                                       .matched();
    }

    public static Parser<Integer> digit() {
        return charMatching(c -> c >= '0' && c <= '9', "digit");
    }

    public static Parser<Integer> hexDigit() {
        return charMatching(c -> (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F'),
                            "hexadecimal digit");
    }

    /**
     * Succeeds with {@code value} without consuming input.
     */
    public static <T> Parser<T> succeed(T value) {
        return input -> Success.of(value, input);
    }

    /**
     * Fails with {@code description} without consuming input.
     */
    public static <T> Parser<T> fail(String description) {
        return input -> Failure.at(input, description);
    }

    public static Parser<Void> endOfInput() {
        return input -> input.isAtEnd()
                        ? Success.of(null, input)
                        : Failure.at(input, "end of input");
    }

    /**
     * Parser resolved on every run, for rules that refer to themselves.
     */
    public static <T> Parser<T> lazy(Supplier<? extends Parser<T>> supplier) {
        return input -> supplier.get()
                                .parse(input);
    }

    private static boolean isWhitespace(int c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }
}
