package com.vigil.resilience;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.http.HttpHeaders;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link HttpRetryClassifier}: retryable status set and {@code Retry-After} parsing.
 */
@DisplayName("HttpRetryClassifier")
class HttpRetryClassifierTest {

    @Nested
    @DisplayName("isRetryableStatus")
    class IsRetryableStatus {

        @Test
        @DisplayName("should treat a missing status as a retryable network failure")
        void shouldRetryMissingStatus() {
            assertThat(HttpRetryClassifier.isRetryableStatus(null)).isTrue();
        }

        @Test
        @DisplayName("should accept exactly 429, 500, 502, 503 and 504")
        void shouldAcceptExactlyTransientStatuses() {
            Set<Integer> expected = Set.of(429, 500, 502, 503, 504);
            for (int status = 100; status < 600; status++) {
                assertThat(HttpRetryClassifier.isRetryableStatus(status))
                        .as("status %d", status)
                        .isEqualTo(expected.contains(status));
            }
        }
    }

    @Nested
    @DisplayName("retryAfterSeconds")
    class RetryAfterSeconds {

        @Test
        @DisplayName("should use a numeric header value")
        void shouldUseNumericValue() {
            var headers = Map.of("Retry-After", List.of("7"));
            assertThat(HttpRetryClassifier.retryAfterSeconds(headers, 1.0, 60.0)).isEqualTo(7.0);
        }

        @Test
        @DisplayName("should cap the header value")
        void shouldCapValue() {
            var headers = Map.of("Retry-After", List.of("3600"));
            assertThat(HttpRetryClassifier.retryAfterSeconds(headers, 1.0, 60.0)).isEqualTo(60.0);
        }

        @Test
        @DisplayName("should match the header name case-insensitively")
        void shouldIgnoreHeaderCase() {
            var headers = Map.of("retry-after", List.of("2.5"));
            assertThat(HttpRetryClassifier.retryAfterSeconds(headers, 1.0, 60.0)).isEqualTo(2.5);
        }

        @Test
        @DisplayName("should fall back to the default for HTTP-date values")
        void shouldFallBackForDates() {
            var headers = Map.of("Retry-After", List.of("Wed, 21 Oct 2015 07:28:00 GMT"));
            assertThat(HttpRetryClassifier.retryAfterSeconds(headers, 4.0, 60.0)).isEqualTo(4.0);
        }

        @Test
        @DisplayName("should fall back to the default when the header is absent")
        void shouldFallBackWhenAbsent() {
            assertThat(HttpRetryClassifier.retryAfterSeconds(Map.of(), 4.0, 60.0)).isEqualTo(4.0);
            assertThat(HttpRetryClassifier.retryAfterSeconds(null, 4.0, 60.0)).isEqualTo(4.0);
        }

        @Test
        @DisplayName("should fall back to the default for negative or non-finite values")
        void shouldRejectNegativeAndNonFinite() {
            assertThat(HttpRetryClassifier.retryAfterSeconds(Map.of("Retry-After", List.of("-3")), 4.0, 60.0))
                    .isEqualTo(4.0);
            assertThat(HttpRetryClassifier.retryAfterSeconds(Map.of("Retry-After", List.of("NaN")), 4.0, 60.0))
                    .isEqualTo(4.0);
        }
    }

    @Nested
    @DisplayName("retryAfter (JDK headers)")
    class RetryAfterDuration {

        @Test
        @DisplayName("should convert seconds to a capped duration")
        void shouldConvertAndCap() {
            HttpHeaders headers = HttpHeaders.of(Map.of("Retry-After", List.of("2")), (name, value) -> true);

            assertThat(HttpRetryClassifier.retryAfter(headers, Duration.ofSeconds(30)))
                    .contains(Duration.ofSeconds(2));
            assertThat(HttpRetryClassifier.retryAfter(headers, Duration.ofSeconds(1)))
                    .contains(Duration.ofSeconds(1));
        }

        @Test
        @DisplayName("should return the default when no hint is usable")
        void shouldReturnDefault() {
            HttpHeaders headers = HttpHeaders.of(Map.of(), (name, value) -> true);

            assertThat(HttpRetryClassifier.retryAfter(headers, Duration.ofMillis(500), Duration.ofSeconds(30)))
                    .isEqualTo(Duration.ofMillis(500));
        }
    }
}
