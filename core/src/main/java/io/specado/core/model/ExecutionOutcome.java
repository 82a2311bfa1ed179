package io.specado.core.model;

import io.specado.core.error.ErrorKind;
import java.time.Duration;
import java.util.Objects;

/**
 * Result of sending a {@link ProviderRequest}.
 *
 * <p>
 * Either a success with the raw response payload, or a classified failure.
 * A failure never carries a payload, even when the provider answered with an
 * error body.
 */
public final class ExecutionOutcome {

    private final ErrorKind kind;
    private final String payload;
    private final String message;
    private final Integer statusCode;
    private final Duration elapsed;
    private final String url;

    private ExecutionOutcome(
            ErrorKind kind, String payload, String message, Integer statusCode, Duration elapsed, String url) {
        this.kind = kind;
        this.payload = payload;
        this.message = message;
        this.statusCode = statusCode;
        this.elapsed = elapsed;
        this.url = url;
    }

    public static ExecutionOutcome success(String payload, int statusCode, Duration elapsed, String url) {
        Objects.requireNonNull(payload, "payload must not be null");
        return new ExecutionOutcome(ErrorKind.SUCCESS, payload, null, statusCode, elapsed, url);
    }

    /**
     * Creates a failure.
     *
     * @param statusCode HTTP status when the provider answered, otherwise null
     */
    public static ExecutionOutcome failure(
            ErrorKind kind, String message, Integer statusCode, Duration elapsed, String url) {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind.isSuccess()) {
            throw new IllegalArgumentException("failure outcome cannot carry SUCCESS");
        }
        return new ExecutionOutcome(kind, null, message, statusCode, elapsed, url);
    }

    public ErrorKind kind() {
        return kind;
    }

    public boolean isSuccess() {
        return kind.isSuccess();
    }

    /** Raw response body, or {@code null} for a failure. */
    public String payload() {
        return payload;
    }

    /** Failure detail, or {@code null} for a success. */
    public String message() {
        return message;
    }

    public Integer statusCode() {
        return statusCode;
    }

    public Duration elapsed() {
        return elapsed;
    }

    /** The endpoint URL the request was sent to. */
    public String url() {
        return url;
    }

    @Override
    public String toString() {
        return "ExecutionOutcome[" + kind + ", status=" + statusCode + ", elapsed=" + elapsed.toMillis() + "ms]";
    }
}
