package io.harvestcore.model;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

public final class Result<T> {
    private final T value;
    private final ErrorKind errorKind;
    private final String error;

    private Result(T value, ErrorKind errorKind, String error) {
        this.value = value;
        this.errorKind = errorKind;
        this.error = error;
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(value, null, null);
    }

    public static <T> Result<T> fail(ErrorKind kind, String error) {
        return new Result<>(null, Objects.requireNonNull(kind, "kind"), error == null ? "" : error);
    }

    public static <T> Result<T> transientFailure(String error) {
        return fail(ErrorKind.TRANSIENT, error);
    }

    public static <T> Result<T> businessFailure(String error) {
        return fail(ErrorKind.BUSINESS, error);
    }

    public static <T> Result<T> fatal(String error) {
        return fail(ErrorKind.FATAL, error);
    }

    public boolean ok() {
        return errorKind == null;
    }

    public T value() {
        if (errorKind != null) {
            throw new IllegalStateException("Result is a failure: " + errorKind + " " + error);
        }
        return value;
    }

    public Optional<ErrorKind> errorKind() {
        return Optional.ofNullable(errorKind);
    }

    public String error() {
        return error;
    }

    public <R> Result<R> map(Function<? super T, ? extends R> fn) {
        if (errorKind != null) {
            return new Result<>(null, errorKind, error);
        }
        return Result.ok(fn.apply(value));
    }

    @Override
    public String toString() {
        return errorKind == null ? "Ok(" + value + ")" : errorKind + "(" + error + ")";
    }
}
