package com.vigil.monitorservice.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.vigil.health.MonitorConfig;
import com.vigil.health.ServiceMonitor;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MonitorLifecycle")
class MonitorLifecycleTest {

    private final ServiceMonitor monitor = new ServiceMonitor(
            MonitorConfig.builder().shutdownTimeout(Duration.ofSeconds(1)).build());

    @AfterEach
    void tearDown() {
        monitor.close();
    }

    @Test
    @DisplayName("starts and stops background monitoring")
    void startsAndStops() {
        var lifecycle = new MonitorLifecycle(monitor, true);

        lifecycle.start();
        assertThat(lifecycle.isRunning()).isTrue();

        lifecycle.stop();
        assertThat(lifecycle.isRunning()).isFalse();
    }

    @Test
    @DisplayName("reports the configured auto-start flag")
    void reportsAutoStart() {
        assertThat(new MonitorLifecycle(monitor, false).isAutoStartup()).isFalse();
        assertThat(new MonitorLifecycle(monitor, true).isAutoStartup()).isTrue();
    }
}
