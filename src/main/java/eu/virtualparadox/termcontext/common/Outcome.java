package eu.virtualparadox.termcontext.common;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a call that may legitimately produce nothing or fail without throwing.
 * <p>
 * Call sites decide how to degrade: a failed similarity score becomes {@code 0.0},
 * a failed fetch becomes an empty passage list, a failed food lookup contributes no summary.
 *
 * @param <T> type of the produced value
 */
public sealed interface Outcome<T> permits Outcome.Success, Outcome.Empty, Outcome.Failed {

    record Success<T>(T value) implements Outcome<T> {
        public Success {
            Objects.requireNonNull(value, "value");
        }
    }

    record Empty<T>() implements Outcome<T> {
    }

    /**
     * @param reason short human-readable description, safe to log
     * @param cause  underlying exception, may be {@code null}
     */
    record Failed<T>(String reason, Throwable cause) implements Outcome<T> {
    }

    static <T> Outcome<T> success(final T value) {
        return new Success<>(value);
    }

    static <T> Outcome<T> empty() {
        return new Empty<>();
    }

    static <T> Outcome<T> failed(final String reason, final Throwable cause) {
        return new Failed<>(reason, cause);
    }

    static <T> Outcome<T> failed(final String reason) {
        return new Failed<>(reason, null);
    }

    /**
     * Wraps a possibly-null value: {@code null} becomes {@link Empty}.
     */
    static <T> Outcome<T> ofNullable(final T value) {
        return value == null ? empty() : success(value);
    }

    default T orElse(final T fallback) {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        return fallback;
    }

    default Optional<T> toOptional() {
        if (this instanceof Success<T> success) {
            return Optional.of(success.value());
        }
        return Optional.empty();
    }
}
