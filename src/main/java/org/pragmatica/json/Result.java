package org.pragmatica.json;

import org.pragmatica.json.error.JsonParseException;
import org.pragmatica.json.error.ParseError;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of parsing a complete text: a value, or the {@link ParseError} explaining why there is none.
 */
public sealed interface Result<T> {

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(ParseError error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    <R> Result<R> map(Function<? super T, ? extends R> mapper);

    <R> Result<R> flatMap(Function<? super T, Result<R>> mapper);

    <R> R fold(Function<? super ParseError, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess);

    /**
     * The value, or {@link JsonParseException} carrying the error.
     */
    T unwrap();

    Optional<ParseError> error();

    default Result<T> onSuccess(Consumer<? super T> action) {
        if (this instanceof Success<T> success) {
            action.accept(success.value());
        }
        return this;
    }

    default Result<T> onFailure(Consumer<? super ParseError> action) {
        if (this instanceof Failure<T> failure) {
            action.accept(failure.cause());
        }
        return this;
    }

    record Success<T>(T value) implements Result<T> {
        public Success {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <R> Result<R> flatMap(Function<? super T, Result<R>> mapper) {
            return mapper.apply(value);
        }

        @Override
        public <R> R fold(Function<? super ParseError, ? extends R> onFailure,
                          Function<? super T, ? extends R> onSuccess) {
            return onSuccess.apply(value);
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public Optional<ParseError> error() {
            return Optional.empty();
        }
    }

    record Failure<T>(ParseError cause) implements Result<T> {
        public Failure {
            Objects.requireNonNull(cause, "cause");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
            return (Result<R>) this;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <R> Result<R> flatMap(Function<? super T, Result<R>> mapper) {
            return (Result<R>) this;
        }

        @Override
        public <R> R fold(Function<? super ParseError, ? extends R> onFailure,
                          Function<? super T, ? extends R> onSuccess) {
            return onFailure.apply(cause);
        }

        @Override
        public T unwrap() {
            throw new JsonParseException(cause);
        }

        @Override
        public Optional<ParseError> error() {
            return Optional.of(cause);
        }
    }
}
