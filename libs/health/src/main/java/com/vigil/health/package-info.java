/**
 * Scheduled health checks for external dependencies.
 *
 * <p>{@link com.vigil.health.ServiceMonitor} runs registered {@link com.vigil.health.HealthCheck}s
 * concurrently, keeps a bounded history per service, reuses recent results while they are fresh
 * and notifies {@link com.vigil.health.AlertHandler}s once a service has failed a configurable
 * number of consecutive times.
 *
 * <pre>{@code
 * try (ServiceMonitor monitor = new ServiceMonitor(MonitorConfig.defaults())) {
 *     monitor.registerService("github-api", githubCheck, "GitHub API");
 *     monitor.registerAlertHandler(new LoggingAlertHandler());
 *     monitor.startMonitoring();
 *     ...
 * }
 * }</pre>
 */
package com.vigil.health;
