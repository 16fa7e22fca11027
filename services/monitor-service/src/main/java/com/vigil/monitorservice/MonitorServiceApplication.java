package com.vigil.monitorservice;

import com.vigil.monitorservice.config.MonitorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Vigil monitor service.
 *
 * <p>Builds one {@link com.vigil.health.ServiceMonitor} from {@code vigil.monitor.*} configuration,
 * starts it with the application context and exposes its status snapshots under
 * {@code /api/v1/health}. Actuator provides the service's own health and metrics endpoints.
 */
@SpringBootApplication
@EnableConfigurationProperties(MonitorProperties.class)
public class MonitorServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(MonitorServiceApplication.class, args);
    }
}
