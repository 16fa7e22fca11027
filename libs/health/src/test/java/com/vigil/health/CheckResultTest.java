package com.vigil.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CheckResult")
class CheckResultTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    @DisplayName("should reject negative latency")
    void shouldRejectNegativeLatency() {
        assertThatThrownBy(() -> new CheckResult(HealthStatus.OK, "x", NOW, -1L, Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("latencyMs");
    }

    @Test
    @DisplayName("should reject missing status")
    void shouldRejectMissingStatus() {
        assertThatThrownBy(() -> CheckResult.of(null, "x", NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should default message to empty and copy extra data")
    void shouldNormalizeFields() {
        Map<String, Object> extra = new HashMap<>();
        extra.put("remaining", 42);

        CheckResult result = new CheckResult(HealthStatus.OK, null, NOW, 12L, extra);
        extra.put("remaining", 0);

        assertThat(result.message()).isEmpty();
        assertThat(result.extra()).containsEntry("remaining", 42);
    }

    @Test
    @DisplayName("should convert a wrapped failure into an ERROR result")
    void shouldConvertFailure() {
        CheckResult result = CheckResult.fromFailure(
                new CheckExecutionException("svc", new IOException("connection refused")), NOW);

        assertThat(result.status()).isEqualTo(HealthStatus.ERROR);
        assertThat(result.message()).isEqualTo("Health check error: connection refused");
        assertThat(result.timestamp()).isEqualTo(NOW);
        assertThat(result.extra()).containsEntry("error", "IOException");
    }

    @Test
    @DisplayName("should describe timeouts with the configured bound")
    void shouldDescribeTimeouts() {
        CheckResult result = CheckResult.fromFailure(new CheckTimeoutException("svc", Duration.ofMillis(250)), NOW);

        assertThat(result.message()).isEqualTo("Health check timed out after 250 ms");
        assertThat(result.extra()).containsEntry("error", "CheckTimeoutException");
    }
}
