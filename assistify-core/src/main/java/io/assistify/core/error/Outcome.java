package io.assistify.core.error;

import java.util.Objects;
import java.util.function.Function;

/**
 * Either a value or an {@link AssistifyError}. A successful outcome may carry a null value.
 */
public record Outcome<T>(T value, AssistifyError error) {

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(value, null);
    }

    public static <T> Outcome<T> failure(AssistifyError error) {
        return new Outcome<>(null, Objects.requireNonNull(error, "error must not be null"));
    }

    public static <T> Outcome<T> failure(ErrorCode code, String message) {
        return failure(AssistifyError.of(code, message));
    }

    public boolean ok() {
        return error == null;
    }

    public T orElseThrow() {
        if (error != null) {
            throw new IllegalStateException(error.code().wireName() + ": " + error.message());
        }
        return value;
    }

    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }
}
