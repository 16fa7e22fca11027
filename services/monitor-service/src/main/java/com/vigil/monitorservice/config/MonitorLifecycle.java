package com.vigil.monitorservice.config;

import com.vigil.health.ServiceMonitor;
import org.springframework.context.SmartLifecycle;

/**
 * Binds background monitoring to the application context: started after the context refreshes
 * (when auto-start is on) and stopped before beans are destroyed.
 */
public class MonitorLifecycle implements SmartLifecycle {

    private final ServiceMonitor monitor;
    private final boolean autoStart;

    public MonitorLifecycle(ServiceMonitor monitor, boolean autoStart) {
        this.monitor = monitor;
        this.autoStart = autoStart;
    }

    @Override
    public void start() {
        monitor.startMonitoring();
    }

    @Override
    public void stop() {
        monitor.stopMonitoring();
    }

    @Override
    public boolean isRunning() {
        return monitor.isRunning();
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }
}
