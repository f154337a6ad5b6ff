package com.polyfetch.common;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one backend fetch. Either a typed value or a {@link FetchError}, never both.
 */
public final class FetchResult<T> {

    private final T value;
    private final FetchError error;

    private FetchResult(T value, FetchError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> FetchResult<T> success(T value) {
        return new FetchResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> FetchResult<T> failure(FetchError error) {
        return new FetchResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> FetchResult<T> failure(String backend, BackendException e) {
        return failure(FetchError.from(backend, e));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    public Optional<FetchError> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FetchResult<?> other)) return false;
        return Objects.equals(value, other.value) && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "Ok(" + value + ")" : "Err(" + error + ")";
    }
}
