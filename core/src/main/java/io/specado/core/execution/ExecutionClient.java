package io.specado.core.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.specado.core.config.EngineConfig;
import io.specado.core.error.ErrorClassifier;
import io.specado.core.error.ErrorKind;
import io.specado.core.model.ExecutionOutcome;
import io.specado.core.model.ProviderRequest;
import io.specado.core.spec.SpecReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends provider requests over the JDK {@link HttpClient}.
 *
 * <p>
 * The timeout bounds the whole exchange, headers and body, measured on the
 * wall clock. Every failure is returned as a classified
 * {@link ExecutionOutcome}; nothing is retried.
 *
 * <p>
 * Thread-safe: the underlying {@link HttpClient} is designed for concurrent
 * use.
 */
public final class ExecutionClient {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutionClient.class);

    /** Headers the JDK client manages itself and refuses to accept. */
    private static final Set<String> RESTRICTED_HEADERS =
            Set.of("connection", "content-length", "expect", "host", "upgrade");

    private final HttpClient httpClient;
    private final Duration defaultTimeout;
    private final Function<String, String> envLookup;
    private final ObjectMapper mapper;

    /** Creates a client resolving header references from {@link System#getenv}. */
    public ExecutionClient(EngineConfig config) {
        this(config, System::getenv);
    }

    public ExecutionClient(EngineConfig config, Function<String, String> envLookup) {
        this(
                HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(config.connectTimeout())
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                config.defaultTimeout(),
                envLookup);
    }

    ExecutionClient(HttpClient httpClient, Duration defaultTimeout, Function<String, String> envLookup) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout must not be null");
        this.envLookup = Objects.requireNonNull(envLookup, "envLookup must not be null");
        this.mapper = SpecReader.jsonMapper();
    }

    /**
     * Sends {@code request} and waits for the complete response.
     *
     * @param request the request to send
     * @param timeout wall-clock bound; {@code null} or zero selects the
     *                configured default
     * @return the raw payload on 2xx, otherwise a classified failure
     * @throws IllegalArgumentException if {@code timeout} is negative
     */
    public ExecutionOutcome execute(ProviderRequest request, Duration timeout) {
        Objects.requireNonNull(request, "request must not be null");
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
        Duration effective = timeout == null || timeout.isZero() ? defaultTimeout : timeout;
        String url = request.url();
        long start = System.nanoTime();

        HttpRequest httpRequest;
        try {
            httpRequest = buildRequest(request, effective);
        } catch (IllegalArgumentException e) {
            return failed(request, ErrorKind.INVALID_INPUT, "Invalid request for " + url + ": " + e.getMessage(),
                    null, start);
        }

        LOG.debug("Sending {} {} (timeout {}ms)", httpRequest.method(), url, effective.toMillis());
        CompletableFuture<HttpResponse<String>> pending =
                httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString());
        HttpResponse<String> response;
        try {
            response = pending.get(effective.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            return failed(
                    request,
                    ErrorKind.TIMEOUT_ERROR,
                    "No complete response from " + url + " within " + effective.toMillis() + "ms",
                    null,
                    start);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            return failed(request, ErrorKind.CANCELLED, "Request to " + url + " was interrupted", null, start);
        } catch (CancellationException e) {
            return failed(request, ErrorKind.CANCELLED, "Request to " + url + " was cancelled", null, start);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            ErrorKind kind = ErrorClassifier.classify(cause);
            if (kind == ErrorKind.UNKNOWN || kind == ErrorKind.INTERNAL_ERROR) {
                kind = ErrorKind.NETWORK_ERROR;
            }
            return failed(request, kind, describeTransportFailure(url, cause), null, start);
        }

        int status = response.statusCode();
        String body = response.body() != null ? response.body() : "";
        if (status >= 200 && status < 300) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            LOG.atInfo()
                    .addKeyValue("provider", request.provider())
                    .addKeyValue("url", url)
                    .addKeyValue("status", status)
                    .addKeyValue("elapsed_ms", elapsed.toMillis())
                    .log("execution.completed");
            return ExecutionOutcome.success(body, status, elapsed, url);
        }

        ProviderError error = ProviderError.parse(mapper, body);
        ErrorKind byStatus = ErrorClassifier.classifyHttpStatus(status, null);
        ErrorKind byCode = ErrorClassifier.classifyHttpStatus(status, error.code());
        ErrorKind kind = byCode != byStatus ? byCode : ErrorClassifier.classifyHttpStatus(status, error.type());
        String message = "HTTP " + status + " from " + url + (error.message() != null ? ": " + error.message() : "");
        return failed(request, kind, message, status, start);
    }

    private HttpRequest buildRequest(ProviderRequest request, Duration timeout) {
        String method = request.endpoint().method().toUpperCase(Locale.ROOT);
        HttpRequest.BodyPublisher publisher = "GET".equals(method) || "DELETE".equals(method)
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(serialize(request));
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(request.url()))
                .timeout(timeout)
                .method(method, publisher);

        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            String name = header.getKey();
            if (RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            Optional<String> value = EnvReferences.expand(header.getValue(), envLookup);
            if (value.isEmpty()) {
                LOG.warn(
                        "Omitting header '{}' for {}: environment variable(s) {} not set",
                        name,
                        request.url(),
                        EnvReferences.referencedNames(header.getValue()));
                continue;
            }
            builder.header(name, value.get());
        }
        return builder.build();
    }

    private String serialize(ProviderRequest request) {
        try {
            return mapper.writeValueAsString(request.body());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("request body cannot be serialized", e);
        }
    }

    private ExecutionOutcome failed(
            ProviderRequest request, ErrorKind kind, String message, Integer status, long start) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        LOG.atWarn()
                .addKeyValue("provider", request.provider())
                .addKeyValue("url", request.url())
                .addKeyValue("kind", kind.name())
                .addKeyValue("status", status)
                .addKeyValue("elapsed_ms", elapsed.toMillis())
                .log("execution.failed: {}", message);
        return ExecutionOutcome.failure(kind, message, status, elapsed, request.url());
    }

    private static String describeTransportFailure(String url, Throwable cause) {
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return "Request to " + url + " failed: " + detail;
    }
}
