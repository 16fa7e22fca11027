package com.vigil.monitorservice.api;

import com.vigil.health.CheckResult;
import com.vigil.health.ServiceMonitor;
import com.vigil.health.ServiceStatus;
import com.vigil.health.SystemStatus;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-mostly JSON view of the monitor for dashboards and scripts.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthStatusController {

    private final ServiceMonitor monitor;

    public HealthStatusController(ServiceMonitor monitor) {
        this.monitor = monitor;
    }

    @GetMapping
    public SystemStatus overall() {
        return monitor.getOverallSystemStatus();
    }

    @GetMapping("/services")
    public Map<String, ServiceStatus> services() {
        return monitor.getAllServiceStatuses();
    }

    @GetMapping("/services/{serviceId}")
    public ServiceStatus service(@PathVariable String serviceId) {
        requireRegistered(serviceId);
        return monitor.getServiceStatus(serviceId);
    }

    @GetMapping("/services/{serviceId}/history")
    public List<CheckResult> history(@PathVariable String serviceId) {
        requireRegistered(serviceId);
        return monitor.getHistory(serviceId);
    }

    /**
     * Runs a pass immediately, independent of the background schedule.
     */
    @PostMapping("/checks")
    public Map<String, CheckResult> runChecks() {
        return monitor.runHealthChecks();
    }

    private void requireRegistered(String serviceId) {
        if (!monitor.isRegistered(serviceId)) {
            throw new UnknownServiceException(serviceId);
        }
    }
}
