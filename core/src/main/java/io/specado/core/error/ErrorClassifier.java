package io.specado.core.error;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.CharacterCodingException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps arbitrary failures onto the {@link ErrorKind} taxonomy.
 *
 * <p>
 * Thread-safe, stateless utility class.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {}

    /**
     * Classifies a throwable. Wrapper exceptions from {@code CompletableFuture}
     * are unwrapped first.
     *
     * @param failure the failure to classify, may be null
     * @return the matching kind, {@link ErrorKind#UNKNOWN} if nothing matches
     */
    public static ErrorKind classify(Throwable failure) {
        Throwable t = unwrap(failure);
        if (t == null) {
            return ErrorKind.UNKNOWN;
        }
        if (t instanceof SpecadoException specado) {
            return specado.kind();
        }
        if (t instanceof JsonProcessingException) {
            return ErrorKind.JSON_ERROR;
        }
        if (t instanceof CharacterCodingException) {
            return ErrorKind.UTF8_ERROR;
        }
        if (t instanceof HttpConnectTimeoutException) {
            return ErrorKind.NETWORK_ERROR;
        }
        if (t instanceof HttpTimeoutException || t instanceof TimeoutException) {
            return ErrorKind.TIMEOUT_ERROR;
        }
        if (t instanceof InterruptedException || t instanceof CancellationException) {
            return ErrorKind.CANCELLED;
        }
        if (t instanceof IOException) {
            return ErrorKind.NETWORK_ERROR;
        }
        if (t instanceof OutOfMemoryError) {
            return ErrorKind.MEMORY_ERROR;
        }
        if (t instanceof NullPointerException) {
            return ErrorKind.NULL_POINTER;
        }
        if (t instanceof UnsupportedOperationException) {
            return ErrorKind.NOT_IMPLEMENTED;
        }
        if (t instanceof IllegalStateException || t instanceof AssertionError) {
            return ErrorKind.INTERNAL_ERROR;
        }
        return ErrorKind.UNKNOWN;
    }

    /**
     * Classifies a non-success provider HTTP response from its status code and
     * the provider's error body conventions (OpenAI {@code error.code}/{@code
     * error.type}, Anthropic {@code error.type}).
     *
     * @param statusCode HTTP status
     * @param errorType  provider error type or code, may be null
     * @return AUTHENTICATION_ERROR, RATE_LIMIT_ERROR, TIMEOUT_ERROR or
     *         NETWORK_ERROR
     */
    public static ErrorKind classifyHttpStatus(int statusCode, String errorType) {
        if (errorType != null) {
            switch (errorType) {
                case "authentication_error", "permission_error", "invalid_api_key" -> {
                    return ErrorKind.AUTHENTICATION_ERROR;
                }
                case "rate_limit_error", "rate_limit_exceeded", "insufficient_quota" -> {
                    return ErrorKind.RATE_LIMIT_ERROR;
                }
                default -> {
                    // fall through to status-based mapping
                }
            }
        }
        return switch (statusCode) {
            case 401, 403 -> ErrorKind.AUTHENTICATION_ERROR;
            case 429 -> ErrorKind.RATE_LIMIT_ERROR;
            case 408, 504 -> ErrorKind.TIMEOUT_ERROR;
            default -> ErrorKind.NETWORK_ERROR;
        };
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
