package org.pragmatica.json.parser;

import org.pragmatica.json.parser.ParseResult.Failure;
import org.pragmatica.json.parser.ParseResult.Success;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Parser combinator - attempts to produce a {@code T} from the input at a cursor.
 *
 * <p>A parser is a pure description: running it never changes the cursor it was given
 * and the same parser can be run any number of times, from any number of threads.
 * Failures are ordinary values. A failure that consumed no input lets alternatives
 * ({@link #or}, {@link #optional}, {@link #many}) take over; a failure after input
 * was consumed propagates as is.
 *
 * <p>Example:
 * <pre>{@code
 * var pair = Parsers.digit().many1()
 *                   .followedBy(Parsers.character(','))
 *                   .and(Parsers.digit().many1());
 *
 * pair.parse("12,3");   // Success(Pair([1, 2], [3]), ...)
 * }</pre>
 */
@FunctionalInterface
public interface Parser<T> {

    ParseResult<T> parse(Cursor input);

    default ParseResult<T> parse(String text) {
        return parse(Cursor.of(text));
    }

    // === Transformation ===

    default <R> Parser<R> map(Function<? super T, ? extends R> mapper) {
        return input -> parse(input).map(mapper);
    }

    /**
     * Run this parser, then the parser computed from its value, from where this one stopped.
     */
    default <R> Parser<R> andThen(Function<? super T, ? extends Parser<R>> next) {
        return input -> {
            var first = parse(input);
            if (first instanceof Failure<T> failure) {
                return failure.cast();
            }
            var success = (Success<T>) first;
            return sequence(input, success, next.apply(success.value()).parse(success.remaining()));
        };
    }

    // === Sequencing ===

    default <R> Parser<Pair<T, R>> and(Parser<R> next) {
        return input -> {
            var first = parse(input);
            if (first instanceof Failure<T> failure) {
                return failure.cast();
            }
            var success = (Success<T>) first;
            var second = next.parse(success.remaining())
                             .map(value -> Pair.of(success.value(), value));
            return sequence(input, success, second);
        };
    }

    /**
     * Sequence keeping the value of {@code next}.
     */
    default <R> Parser<R> then(Parser<R> next) {
        return input -> {
            var first = parse(input);
            if (first instanceof Failure<T> failure) {
                return failure.cast();
            }
            var success = (Success<T>) first;
            return sequence(input, success, next.parse(success.remaining()));
        };
    }

    /**
     * Sequence keeping the value of this parser.
     */
    default Parser<T> followedBy(Parser<?> next) {
        return input -> {
            var first = parse(input);
            if (first instanceof Failure<T> failure) {
                return failure;
            }
            var success = (Success<T>) first;
            var second = next.parse(success.remaining())
                             .map(ignored -> success.value());
            return sequence(input, success, second);
        };
    }

    default Parser<T> between(Parser<?> open, Parser<?> close) {
        return open.then(this)
                   .followedBy(close);
    }

    // === Alternation ===

    /**
     * Try {@code alternative} from the same cursor if this parser failed without consuming input.
     */
    default Parser<T> or(Parser<T> alternative) {
        return input -> {
            var first = parse(input);
            if (first instanceof Failure<T> failure && !failure.consumed()) {
                return orElse(failure.expected(), alternative.parse(input));
            }
            return first;
        };
    }

    /**
     * Ordered choice between any number of alternatives, with {@link #or} semantics.
     */
    @SafeVarargs
    static <T> Parser<T> choice(Parser<T>... alternatives) {
        if (alternatives.length == 0) {
            throw new IllegalArgumentException("choice requires at least one alternative");
        }
        var options = List.of(alternatives);
        return input -> {
            var expected = Expectation.at(input.offset(), "");
            for (var option : options) {
                var result = option.parse(input);
                if (result instanceof Failure<T> failure && !failure.consumed()) {
                    expected = expected.merge(failure.expected());
                    continue;
                }
                return orElse(expected, result);
            }
            return Failure.empty(expected);
        };
    }

    // === Repetition ===

    /**
     * Zero or more repetitions. Stops at the first failure that consumed nothing, or at
     * the first success that consumed nothing, so it always terminates.
     */
    default Parser<List<T>> many() {
        return input -> {
            var values = new ArrayList<T>();
            var cursor = input;
            var hint = Expectation.NONE;
            while (true) {
                var result = parse(cursor);
                if (result instanceof Failure<T> failure) {
                    if (failure.consumed()) {
                        return Failure.consumed(hint.merge(failure.expected()));
                    }
                    return new Success<>(Collections.unmodifiableList(values), cursor, hint.merge(failure.expected()));
                }
                var success = (Success<T>) result;
                hint = hint.merge(success.hint());
                if (success.remaining().offset() == cursor.offset()) {
                    return new Success<>(Collections.unmodifiableList(values), cursor, hint);
                }
                values.add(success.value());
                cursor = success.remaining();
            }
        };
    }

    default Parser<List<T>> many1() {
        return and(many()).map(Parser::prepend);
    }

    /**
     * Exactly {@code count} repetitions.
     */
    default Parser<List<T>> times(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("times requires a non-negative count");
        }
        return input -> {
            var values = new ArrayList<T>(count);
            var cursor = input;
            var hint = Expectation.NONE;
            for (int i = 0; i < count; i++) {
                var result = parse(cursor);
                if (result instanceof Failure<T> failure) {
                    var consumed = failure.consumed() || cursor.offset() > input.offset();
                    return new Failure<>(hint.merge(failure.expected()), consumed);
                }
                var success = (Success<T>) result;
                values.add(success.value());
                hint = hint.merge(success.hint());
                cursor = success.remaining();
            }
            return new Success<>(Collections.unmodifiableList(values), cursor, hint);
        };
    }

    default Parser<Optional<T>> optional() {
        return input -> {
            var result = parse(input);
            if (result instanceof Failure<T> failure) {
                return failure.consumed()
                       ? failure.cast()
                       : new Success<>(Optional.<T>empty(), input, failure.expected());
            }
            return result.map(Optional::of);
        };
    }

    /**
     * Zero or more values separated by {@code separator}, without a trailing separator.
     */
    default Parser<List<T>> sepBy(Parser<?> separator) {
        return sepBy1(separator).optional()
                                .map(values -> values.orElse(List.of()));
    }

    /**
     * One or more values separated by {@code separator}, without a trailing separator.
     */
    default Parser<List<T>> sepBy1(Parser<?> separator) {
        return and(separator.then(this).many()).map(Parser::prepend);
    }

    // === Reporting ===

    /**
     * Describe what this parser expects when it fails without consuming input.
     * An empty description hides the expectation.
     */
    default Parser<T> label(String description) {
        return input -> {
            var result = parse(input);
            if (result instanceof Failure<T> failure && !failure.consumed()) {
                return Failure.empty(failure.expected().relabel(description));
            }
            return result;
        };
    }

    // === Input Capture ===

    /**
     * The text consumed by this parser instead of its value.
     */
    default Parser<String> matched() {
        return input -> {
            var result = parse(input);
            if (result instanceof Success<T> success) {
                var remaining = success.remaining();
                return new Success<>(remaining.consumedSince(input), remaining, success.hint());
            }
            return ((Failure<T>) result).cast();
        };
    }

    // === Nesting ===

    /**
     * Run this parser one nesting level deeper, failing once {@code maxDepth} levels are open.
     * The failure counts as consuming, so no alternative is tried.
     */
    default Parser<T> nested(int maxDepth) {
        return input -> {
            if (input.depth() >= maxDepth) {
                return Failure.consumed(Expectation.at(input.offset(), "nesting depth of at most " + maxDepth));
            }
            var result = parse(input.enter());
            if (result instanceof Success<T> success) {
                return new Success<>(success.value(), success.remaining().leave(), success.hint());
            }
            return result;
        };
    }

    // === Internals ===

    private static <A, R> ParseResult<R> sequence(Cursor start, Success<A> first, ParseResult<R> second) {
        if (second instanceof Success<R> success) {
            return new Success<>(success.value(), success.remaining(), first.hint().merge(success.hint()));
        }
        var failure = (Failure<R>) second;
        var consumed = failure.consumed() || first.remaining().offset() > start.offset();
        return new Failure<>(first.hint().merge(failure.expected()), consumed);
    }

    private static <T> ParseResult<T> orElse(Expectation previous, ParseResult<T> next) {
        if (next instanceof Success<T> success) {
            return success.withHint(previous);
        }
        var failure = (Failure<T>) next;
        return failure.consumed()
               ? failure
               : Failure.empty(previous.merge(failure.expected()));
    }

    private static <T> List<T> prepend(Pair<T, List<T>> pair) {
        var values = new ArrayList<T>(pair.second().size() + 1);
        values.add(pair.first());
        values.addAll(pair.second());
        return Collections.unmodifiableList(values);
    }
}
