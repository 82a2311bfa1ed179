package io.specado.core.error;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of an engine operation. Exactly one of two states:
 *
 * <ul>
 * <li>success: {@link #kind()} is {@link ErrorKind#SUCCESS} and
 * {@link #value()} holds the payload;</li>
 * <li>failure: {@link #kind()} is any other kind, {@link #message()} holds a
 * human-readable detail and {@link #value()} is {@code null}.</li>
 * </ul>
 *
 * <p>
 * Immutable, thread-safe when the payload is.
 *
 * @param <T> payload type
 */
public final class Outcome<T> {

    private final ErrorKind kind;
    private final T value;
    private final String message;

    private Outcome(ErrorKind kind, T value, String message) {
        this.kind = kind;
        this.value = value;
        this.message = message;
    }

    /** Creates a successful outcome carrying {@code value}. */
    public static <T> Outcome<T> success(T value) {
        Objects.requireNonNull(value, "value must not be null for SUCCESS");
        return new Outcome<>(ErrorKind.SUCCESS, value, null);
    }

    /** Creates a failed outcome. {@code kind} must not be {@link ErrorKind#SUCCESS}. */
    public static <T> Outcome<T> failure(ErrorKind kind, String message) {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind.isSuccess()) {
            throw new IllegalArgumentException("failure outcome cannot carry SUCCESS");
        }
        return new Outcome<>(kind, null, message != null ? message : kind.name());
    }

    /** Creates a failed outcome from an engine exception. */
    public static <T> Outcome<T> failure(SpecadoException e) {
        return failure(e.kind(), e.getMessage());
    }

    public ErrorKind kind() {
        return kind;
    }

    /** The success payload, or {@code null} for a failure. */
    public T value() {
        return value;
    }

    /** Failure detail, or {@code null} for a success. */
    public String message() {
        return message;
    }

    public boolean isSuccess() {
        return kind.isSuccess();
    }

    public boolean isFailure() {
        return !kind.isSuccess();
    }

    /** Transforms the payload of a success; failures pass through unchanged. */
    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (isFailure()) {
            return new Outcome<>(kind, null, message);
        }
        return Outcome.success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isSuccess() ? "Outcome[SUCCESS]" : "Outcome[" + kind + ", message=" + message + "]";
    }
}
