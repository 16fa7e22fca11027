package com.vigil.resilience;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;

/**
 * Tests for {@link RetryingHttpClient}: transient statuses and transport errors are retried,
 * {@code Retry-After} drives the sleep, and non-transient responses are returned untouched.
 */
@DisplayName("RetryingHttpClient")
class RetryingHttpClientTest {

    private final HttpRequest request = HttpRequest.newBuilder(URI.create("https://api.example.test/v1/generate"))
            .GET()
            .build();
    private final List<Duration> sleeps = new ArrayList<>();
    private final RetryPolicy policy = RetryPolicy.builder()
            .maxRetries(2)
            .baseDelay(Duration.ofMillis(50))
            .maxDelay(Duration.ofSeconds(10))
            .jitter(false)
            .build();

    private HttpClient delegate;
    private RetryingHttpClient client;

    @BeforeEach
    void setUp() {
        delegate = mock(HttpClient.class);
        client = new RetryingHttpClient(delegate, new RetryExecutor(sleeps::add, () -> 0.5, List.of()), policy);
    }

    @Test
    @DisplayName("should return a successful response on the first attempt")
    void shouldReturnSuccess() throws Exception {
        HttpResponse<String> ok = response(200, Map.of());
        when(delegate.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
                .thenReturn(ok);

        HttpResponse<String> result = client.send(request, HttpResponse.BodyHandlers.ofString());

        assertThat(result).isSameAs(ok);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("should retry a 503 and honor its Retry-After header")
    void shouldRetryServiceUnavailable() throws Exception {
        HttpResponse<String> unavailable = response(503, Map.of("Retry-After", List.of("3")));
        HttpResponse<String> ok = response(200, Map.of());
        when(delegate.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
                .thenReturn(unavailable, ok);

        HttpResponse<String> result = client.send(request, HttpResponse.BodyHandlers.ofString());

        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(3));
    }

    @Test
    @DisplayName("should retry transport failures with computed backoff")
    void shouldRetryConnectionErrors() throws Exception {
        HttpResponse<String> ok = response(200, Map.of());
        when(delegate.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
                .thenThrow(new ConnectException("refused"))
                .thenReturn(ok);

        HttpResponse<String> result = client.send(request, HttpResponse.BodyHandlers.ofString());

        assertThat(result).isSameAs(ok);
        assertThat(sleeps).containsExactly(Duration.ofMillis(50));
    }

    @Test
    @DisplayName("should return client errors without retrying")
    void shouldNotRetryClientErrors() throws Exception {
        HttpResponse<String> notFound = response(404, Map.of());
        when(delegate.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
                .thenReturn(notFound);

        HttpResponse<String> result = client.send(request, HttpResponse.BodyHandlers.ofString());

        assertThat(result.statusCode()).isEqualTo(404);
        verify(delegate, times(1)).send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    }

    @Test
    @DisplayName("should throw RetryExhaustedException carrying the last status")
    void shouldExhaustOnPersistentFailure() throws Exception {
        HttpResponse<String> busy = response(429, Map.of());
        when(delegate.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
                .thenReturn(busy);

        assertThatThrownBy(() -> client.send(request, HttpResponse.BodyHandlers.ofString()))
                .isInstanceOf(RetryExhaustedException.class)
                .hasCauseInstanceOf(RetryableHttpException.class)
                .satisfies(e -> assertThat(((RetryableHttpException) e.getCause()).statusCode()).isEqualTo(429));

        verify(delegate, times(3)).send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
        assertThat(sleeps).containsExactly(Duration.ofMillis(50), Duration.ofMillis(100));
    }

    @Test
    @DisplayName("should reject a policy that does not retry RetryableException")
    void shouldRejectIncompatiblePolicy() {
        RetryPolicy ioOnly = RetryPolicy.builder().retryOn(java.io.IOException.class).build();

        assertThatThrownBy(() -> new RetryingHttpClient(delegate, new RetryExecutor(), ioOnly))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status, Map<String, List<String>> headers) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.headers()).thenReturn(HttpHeaders.of(headers, (name, value) -> true));
        return response;
    }
}
