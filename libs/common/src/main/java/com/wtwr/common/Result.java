package com.wtwr.common;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Either a value or an {@link ApiError}. Pipeline stages return a {@code Result} instead of
 * throwing, so every failure is handed on explicitly to the next stage's failure path.
 *
 * @param <T> type of the success value
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> err(ApiError error) {
        return new Err<>(error);
    }

    boolean isOk();

    default boolean isErr() {
        return !isOk();
    }

    /**
     * Returns the success value.
     *
     * @throws IllegalStateException if this is an error
     */
    T value();

    /**
     * Returns the error.
     *
     * @throws IllegalStateException if this is a success
     */
    ApiError error();

    <U> Result<U> map(Function<? super T, ? extends U> mapper);

    <U> Result<U> flatMap(Function<? super T, Result<U>> mapper);

    /** Collapses both branches into one value. */
    <U> U fold(Function<? super T, ? extends U> onOk, Function<? super ApiError, ? extends U> onErr);

    /** Runs the action on the success value and returns this result unchanged. */
    Result<T> peek(Consumer<? super T> action);

    record Ok<T>(T value) implements Result<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public ApiError error() {
            throw new IllegalStateException("Ok result has no error");
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
            return Objects.requireNonNull(mapper.apply(value), "flatMap mapper returned null");
        }

        @Override
        public <U> U fold(
                Function<? super T, ? extends U> onOk, Function<? super ApiError, ? extends U> onErr) {
            return onOk.apply(value);
        }

        @Override
        public Result<T> peek(Consumer<? super T> action) {
            action.accept(value);
            return this;
        }
    }

    record Err<T>(ApiError error) implements Result<T> {

        public Err {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException("Err result has no value: " + error.message());
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Err<>(error);
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
            return new Err<>(error);
        }

        @Override
        public <U> U fold(
                Function<? super T, ? extends U> onOk, Function<? super ApiError, ? extends U> onErr) {
            return onErr.apply(error);
        }

        @Override
        public Result<T> peek(Consumer<? super T> action) {
            return this;
        }
    }
}
