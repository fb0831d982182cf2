package com.streamfirst.dbsync.domain;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Either a value or a classified failure. Used by operations that report their outcome to the
 * caller instead of throwing, such as a manually triggered backup.
 *
 * @param <T> the type of data returned on success
 */
@Value
@EqualsAndHashCode
public class Result<T> {

    boolean success;
    T data;
    ErrorKind errorKind;
    String errorMessage;

    private Result(boolean success, T data, ErrorKind errorKind, String errorMessage) {
        this.success = success;
        this.data = data;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    public static <T> Result<T> success(@NonNull T data) {
        return new Result<>(true, data, null, null);
    }

    public static <T> Result<T> failure(@NonNull ErrorKind kind, String errorMessage) {
        return new Result<>(false, null, kind, errorMessage);
    }

    /**
     * Converts a coordinator exception into a failure of the same kind.
     */
    public static <T> Result<T> failure(@NonNull DbSyncException error) {
        return new Result<>(false, null, error.getKind(), error.getMessage());
    }

    /**
     * Returns the data if successful, or throws an exception if failed.
     */
    public T orElseThrow() {
        if (success) {
            return data;
        }
        throw new IllegalStateException(errorMessage + " (" + errorKind + ")");
    }

    public T orElse(T defaultValue) {
        return success ? data : defaultValue;
    }

    public T orElseGet(Supplier<T> supplier) {
        return success ? data : supplier.get();
    }

    /**
     * Maps the data to another type if successful, preserves failure if failed.
     */
    public <U> Result<U> map(Function<T, U> mapper) {
        if (success) {
            return Result.success(mapper.apply(data));
        }
        return new Result<>(false, null, errorKind, errorMessage);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public Optional<T> getData() {
        return success ? Optional.ofNullable(data) : Optional.empty();
    }

    public Optional<ErrorKind> getErrorKind() {
        return Optional.ofNullable(errorKind);
    }

    public Optional<String> getErrorMessage() {
        return success ? Optional.empty() : Optional.ofNullable(errorMessage);
    }

    @Override
    public String toString() {
        if (success) {
            return "Result.success(" + data + ")";
        }
        return "Result.failure(" + errorKind + ", " + errorMessage + ")";
    }
}
