package com.vigil.resilience;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

/**
 * JDK {@link HttpClient} decorator that retries transient failures through a {@link RetryExecutor}.
 * <p>
 * Retried:
 * <ul>
 *   <li>{@link IOException} from the transport (no status code: connection refused, timeouts)</li>
 *   <li>statuses 429, 500, 502, 503 and 504; a numeric {@code Retry-After} header replaces the
 *       computed backoff for that attempt</li>
 * </ul>
 * Every other response, successful or not, is returned to the caller unchanged. When the budget is
 * used up the caller receives {@link RetryExhaustedException} wrapping the last failure.
 */
public final class RetryingHttpClient {

    private final HttpClient delegate;
    private final RetryExecutor executor;
    private final RetryPolicy policy;

    /**
     * Creates a retrying client.
     *
     * @param delegate the transport
     * @param executor executor driving the attempts
     * @param policy   retry configuration; must treat {@link RetryableException} as retryable
     */
    public RetryingHttpClient(HttpClient delegate, RetryExecutor executor, RetryPolicy policy) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate must not be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        if (policy == null || !policy.isRetryable(new RetryableException("probe"))) {
            throw new IllegalArgumentException("policy must retry RetryableException");
        }
        this.delegate = delegate;
        this.executor = executor;
        this.policy = policy;
    }

    /**
     * Sends the request, retrying transient failures.
     *
     * @throws RetryExhaustedException if every attempt failed transiently
     * @throws InterruptedException    if interrupted while sending or backing off
     */
    public <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> bodyHandler)
            throws InterruptedException {
        String operation = request.method() + " " + request.uri().getHost();
        try {
            return executor.execute(operation, () -> attempt(request, bodyHandler), policy);
        } catch (RuntimeException | InterruptedException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Unexpected failure sending " + operation, e);
        }
    }

    /**
     * Returns the policy applied to every request.
     */
    public RetryPolicy policy() {
        return policy;
    }

    private <T> HttpResponse<T> attempt(HttpRequest request, HttpResponse.BodyHandler<T> bodyHandler)
            throws InterruptedException {
        HttpResponse<T> response;
        try {
            response = delegate.send(request, bodyHandler);
        } catch (IOException e) {
            throw new RetryableException("Network failure calling " + request.uri() + ": " + e.getMessage(), e);
        }

        int status = response.statusCode();
        if (HttpRetryClassifier.isRetryableStatus(status)) {
            Optional<Duration> hint = HttpRetryClassifier.retryAfter(response.headers(), policy.maxDelay());
            throw new RetryableHttpException(status,
                    request.uri() + " returned status " + status, hint.orElse(null));
        }
        return response;
    }
}
