package com.vigil.monitorservice.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.vigil.health.HealthStatus;
import com.vigil.health.MonitorConfig;
import com.vigil.health.ServiceMonitor;
import com.vigil.health.testing.InMemoryHealthCheck;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link HealthStatusController} against a real monitor with in-memory checks.
 */
@DisplayName("HealthStatusController")
class HealthStatusControllerTest {

    private ServiceMonitor monitor;
    private HealthStatusController controller;
    private final InMemoryHealthCheck billing = new InMemoryHealthCheck();

    @BeforeEach
    void setUp() {
        monitor = new ServiceMonitor(MonitorConfig.builder().cacheTtl(Duration.ZERO).build());
        monitor.registerService("billing-api", billing, "Billing API");
        controller = new HealthStatusController(monitor);
    }

    @AfterEach
    void tearDown() {
        monitor.close();
    }

    @Test
    @DisplayName("runs a pass and exposes its results through every view")
    void exposesPassResults() {
        billing.setError("503 from upstream");

        assertThat(controller.runChecks().get("billing-api").status()).isEqualTo(HealthStatus.ERROR);
        assertThat(controller.overall().status()).isEqualTo(HealthStatus.ERROR);
        assertThat(controller.services()).containsOnlyKeys("billing-api");
        assertThat(controller.service("billing-api").message()).isEqualTo("503 from upstream");
        assertThat(controller.history("billing-api")).hasSize(1);
    }

    @Test
    @DisplayName("rejects unknown service ids")
    void rejectsUnknownIds() {
        assertThatThrownBy(() -> controller.service("ghost"))
                .isInstanceOf(UnknownServiceException.class)
                .hasMessage("Unknown service: ghost");
        assertThatThrownBy(() -> controller.history("ghost"))
                .isInstanceOf(UnknownServiceException.class);
    }
}
