package org.conflux.runtime.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a converter directory call. Callers must decide how to react to a
 * {@link Failure}; the directory never hides errors behind exceptions.
 *
 * @param <T> the value type of a successful call
 */
public sealed interface NodeResult<T> permits NodeResult.Ok, NodeResult.Failure {

    /**
     * A successful call.
     * @param value The returned value, {@code null} for calls without a result.
     */
    record Ok<T>(T value) implements NodeResult<T> {}

    /**
     * A failed call.
     * @param error What went wrong.
     */
    record Failure<T>(ConversionError error) implements NodeResult<T> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }
    }

    static <T> NodeResult<T> ok(T value) {
        return new Ok<>(value);
    }

    static NodeResult<Void> done() {
        return new Ok<>(null);
    }

    static <T> NodeResult<T> failure(ConversionErrorKind kind, String message) {
        return new Failure<>(new ConversionError(kind, message));
    }

    static <T> NodeResult<T> failure(ConversionError error) {
        return new Failure<>(error);
    }

    default boolean isOk() {
        return this instanceof Ok<T>;
    }

    default Optional<ConversionError> getError() {
        if (this instanceof Failure<T> failure) {
            return Optional.of(failure.error());
        }
        return Optional.empty();
    }

    /**
     * Returns true only for a successful call whose value is {@code Boolean.TRUE}.
     */
    default boolean isTrue() {
        return this instanceof Ok<T> ok && Boolean.TRUE.equals(ok.value());
    }
}
