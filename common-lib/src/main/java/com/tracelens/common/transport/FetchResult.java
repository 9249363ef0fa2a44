package com.tracelens.common.transport;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a fetch: either a value or a {@link FetchError}, never both.
 *
 * <p>Transport failures travel as data so that callers decide explicitly what to show.
 * Nothing downstream substitutes synthetic records for a failure.
 *
 * <pre>
 *   client.fetchWindow(range, 0)
 *       .map(result -&gt; result.map(engine::summarize))
 *       .map(result -&gt; result.fold(ResponseEntity::ok, this::badGateway));
 * </pre>
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

    public boolean isSuccess() {
        return error == null;
    }

    /** @throws IllegalStateException on a failure */
    public T value() {
        if (error != null) {
            throw new IllegalStateException("No value on failed fetch: " + error.message());
        }
        return value;
    }

    /** @throws IllegalStateException on a success */
    public FetchError error() {
        if (error == null) {
            throw new IllegalStateException("No error on successful fetch");
        }
        return error;
    }

    /** Transforms the value; a failure passes through untouched. */
    public <R> FetchResult<R> map(Function<? super T, ? extends R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(error);
    }

    /** Chains a second fallible step; the first failure wins. */
    public <R> FetchResult<R> flatMap(Function<? super T, FetchResult<R>> mapper) {
        return isSuccess() ? mapper.apply(value) : failure(error);
    }

    public <R> R fold(Function<? super T, ? extends R> onSuccess,
                      Function<? super FetchError, ? extends R> onFailure) {
        return isSuccess() ? onSuccess.apply(value) : onFailure.apply(error);
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
        return isSuccess() ? "FetchResult.success(" + value + ")" : "FetchResult.failure(" + error + ")";
    }
}
