package org.pragmatica.json.parser;

import java.util.function.Function;

/**
 * Result of running a parser - either success with a value and the advanced cursor, or failure.
 */
public sealed interface ParseResult<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    <R> ParseResult<R> map(Function<? super T, ? extends R> mapper);

    /**
     * Successful parse with the produced value and the cursor after the consumed input.
     *
     * @param hint furthest expectation that failed without consuming input while this parse succeeded
     */
    record Success<T>(T value, Cursor remaining, Expectation hint) implements ParseResult<T> {

        public static <T> Success<T> of(T value, Cursor remaining) {
            return new Success<>(value, remaining, Expectation.NONE);
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(value), remaining, hint);
        }

        public Success<T> withHint(Expectation other) {
            return new Success<>(value, remaining, hint.merge(other));
        }
    }

    /**
     * Failed parse.
     *
     * @param consumed whether input was consumed before the failure; alternatives are only
     *                 tried after failures that consumed nothing
     */
    record Failure<T>(Expectation expected, boolean consumed) implements ParseResult<T> {

        public static <T> Failure<T> empty(Expectation expected) {
            return new Failure<>(expected, false);
        }

        public static <T> Failure<T> consumed(Expectation expected) {
            return new Failure<>(expected, true);
        }

        public static <T> Failure<T> at(Cursor cursor, String expected) {
            return empty(Expectation.at(cursor.offset(), expected));
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        public int offset() {
            return expected.offset();
        }

        @Override
        @SuppressWarnings("unchecked")
        public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
            return (ParseResult<R>) this;
        }

        /**
         * Same failure, retyped.
         */
        @SuppressWarnings("unchecked")
        public <R> Failure<R> cast() {
            return (Failure<R>) this;
        }
    }
}
