package com.vigil.monitorservice.config;

import com.vigil.health.AlertHandler;
import com.vigil.health.HealthCheck;
import com.vigil.health.LoggingAlertHandler;
import com.vigil.health.ServiceMonitor;
import com.vigil.health.StatusSnapshotSerializer;
import com.vigil.health.http.GitHubRateLimitHealthCheck;
import com.vigil.health.http.HttpPingHealthCheck;
import com.vigil.monitorservice.config.MonitorProperties.ServiceTarget;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the {@link ServiceMonitor} and the probes for every configured dependency.
 */
@Configuration
public class MonitorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MonitorConfiguration.class);

    static final String INSTRUMENTATION_NAME = "vigil-monitor-service";

    @Bean
    public HttpClient healthCheckHttpClient(MonitorProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.requestTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Renders API responses with the same JSON settings as {@link StatusSnapshotSerializer}.
     */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer statusSnapshotJsonCustomizer() {
        return builder -> builder.postConfigurer(StatusSnapshotSerializer::configure);
    }

    @Bean
    public LoggingAlertHandler loggingAlertHandler() {
        return new LoggingAlertHandler();
    }

    @Bean
    public ServiceMonitor serviceMonitor(MonitorProperties properties, MeterRegistry meterRegistry,
                                         HttpClient healthCheckHttpClient, ObjectProvider<AlertHandler> alertHandlers) {
        ServiceMonitor monitor = ServiceMonitor.builder()
                .config(properties.toMonitorConfig())
                .meterRegistry(meterRegistry)
                .tracer(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME))
                .build();
        for (ServiceTarget target : properties.services()) {
            HealthCheck check = checkFor(target, healthCheckHttpClient, properties.requestTimeout());
            monitor.registerService(target.id(), check, target.displayName(), blankToNull(target.url()));
        }
        alertHandlers.orderedStream().forEach(monitor::registerAlertHandler);
        log.info("Configured health monitor for {} services", properties.services().size());
        return monitor;
    }

    @Bean
    public MonitorLifecycle monitorLifecycle(ServiceMonitor serviceMonitor, MonitorProperties properties) {
        return new MonitorLifecycle(serviceMonitor, properties.autoStart());
    }

    static HealthCheck checkFor(ServiceTarget target, HttpClient client, Duration requestTimeout) {
        String url = blankToNull(target.url());
        switch (target.type()) {
            case HTTP_PING:
                return new HttpPingHealthCheck(target.displayName(), client,
                        url != null ? URI.create(url) : null, target.token(), requestTimeout);
            case GITHUB_RATE_LIMIT:
                return new GitHubRateLimitHealthCheck(client,
                        url != null ? URI.create(url) : GitHubRateLimitHealthCheck.DEFAULT_API_BASE,
                        target.token(), requestTimeout, GitHubRateLimitHealthCheck.DEFAULT_LOW_THRESHOLD);
            default:
                throw new IllegalArgumentException("Unsupported check type: " + target.type());
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
