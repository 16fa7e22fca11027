package com.vigil.health;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodically runs registered health checks, keeps a bounded history per service and raises
 * alerts on sustained failure.
 * <p>
 * Each pass runs every registered check concurrently on a fixed worker pool. A check that throws
 * or exceeds the per-check timeout yields an ERROR result instead of failing the pass. Fresh
 * results are appended to history and cached; a result still inside the cache TTL is reused
 * without invoking the check and is not appended again.
 * <p>
 * Thread safety: registry, history, cache and alert evaluation share one state lock. Passes are
 * serialized, so a manual {@link #runHealthChecks()} never overlaps a scheduled one. Alert
 * handlers are invoked outside the state lock.
 * <p>
 * Each instance owns its state; create one per application and {@link #close()} it on shutdown.
 */
public final class ServiceMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServiceMonitor.class);

    private final MonitorConfig config;
    private final Clock clock;
    private final MonitorMetrics metrics;
    private final CheckTracer tracer;
    private final AlertRuleEngine alerts;

    private final ReentrantLock stateLock = new ReentrantLock();
    private final HealthCheckRegistry registry = new HealthCheckRegistry();
    private final HistoryStore histories;
    private final ResultCache cache;

    private final ReentrantLock passLock = new ReentrantLock();
    private final AtomicLong passSequence = new AtomicLong();

    private final Object lifecycleLock = new Object();
    private Thread schedulerThread;
    private CountDownLatch stopSignal;
    private ExecutorService workers;

    private record PendingCheck(ServiceRegistration registration, Future<CheckResult> future,
                                long submittedAtNanos, AtomicBoolean started) {
    }

    public ServiceMonitor(MonitorConfig config) {
        this(builder().config(config));
    }

    private ServiceMonitor(Builder builder) {
        this.config = builder.config;
        this.clock = builder.clock;
        this.metrics = new MonitorMetrics(
                builder.meterRegistry != null ? builder.meterRegistry : new SimpleMeterRegistry());
        this.tracer = builder.tracer != null ? new CheckTracer(builder.tracer) : CheckTracer.noop();
        this.alerts = new AlertRuleEngine(config.alertThreshold());
        this.histories = new HistoryStore(config.historySize());
        this.cache = new ResultCache(config.cacheTtl());
        this.metrics.bindServiceCount(this::serviceCount);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ── Registration ──

    /**
     * Registers a service under its id as display name.
     */
    public void registerService(String serviceId, HealthCheck check) {
        registerService(serviceId, check, serviceId, null);
    }

    public void registerService(String serviceId, HealthCheck check, String displayName) {
        registerService(serviceId, check, displayName, null);
    }

    /**
     * Adds a service to the monitor. Registering an id again replaces the check and display name
     * and discards the service's history and cached result.
     *
     * @throws IllegalArgumentException if the id is blank or the check is null
     */
    public void registerService(String serviceId, HealthCheck check, String displayName, String serviceUrl) {
        ServiceRegistration registration = new ServiceRegistration(serviceId, check, displayName, serviceUrl);
        stateLock.lock();
        try {
            Optional<ServiceRegistration> replaced = registry.register(registration);
            histories.reset(serviceId);
            cache.invalidate(serviceId);
            if (replaced.isPresent()) {
                log.info("Re-registered service for health monitoring: {}", serviceId);
            } else {
                log.info("Registered service for health monitoring: {}", serviceId);
            }
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Adds an alert handler. Handlers run in registration order; one that throws does not
     * prevent the others from running.
     */
    public void registerAlertHandler(AlertHandler handler) {
        alerts.addHandler(handler);
    }

    public boolean isRegistered(String serviceId) {
        stateLock.lock();
        try {
            return registry.contains(serviceId);
        } finally {
            stateLock.unlock();
        }
    }

    /** Registered ids in registration order. */
    public List<String> serviceIds() {
        stateLock.lock();
        try {
            List<String> ids = new ArrayList<>();
            registry.all().forEach(r -> ids.add(r.serviceId()));
            return Collections.unmodifiableList(ids);
        } finally {
            stateLock.unlock();
        }
    }

    public int serviceCount() {
        stateLock.lock();
        try {
            return registry.size();
        } finally {
            stateLock.unlock();
        }
    }

    // ── Check passes ──

    /**
     * Runs one pass over every registered service and returns the result per service, in
     * registration order. Never throws because of a failing check.
     */
    public Map<String, CheckResult> runHealthChecks() {
        passLock.lock();
        try {
            return runPass(passSequence.incrementAndGet());
        } finally {
            passLock.unlock();
        }
    }

    private Map<String, CheckResult> runPass(long pass) {
        Instant startedAt = clock.instant();
        List<ServiceRegistration> order;
        Map<String, CheckResult> cached = new LinkedHashMap<>();
        List<ServiceRegistration> toRun = new ArrayList<>();

        stateLock.lock();
        try {
            order = registry.all();
            for (ServiceRegistration registration : order) {
                Optional<CheckResult> hit = cache.getFresh(registration.serviceId(), startedAt);
                if (hit.isPresent()) {
                    cached.put(registration.serviceId(), hit.get());
                } else {
                    toRun.add(registration);
                }
            }
        } finally {
            stateLock.unlock();
        }
        log.debug("Health check pass {}: {} services, {} served from cache", pass, order.size(), cached.size());

        Map<String, CheckResult> results = new HashMap<>();
        cached.forEach((serviceId, result) -> {
            results.put(serviceId, result);
            metrics.recordCached(serviceId);
            recordCached(serviceId, result);
        });

        List<PendingCheck> pending = submit(toRun, pass);
        long timeoutNanos = config.checkTimeout().toNanos();
        boolean interrupted = false;
        for (PendingCheck check : pending) {
            String serviceId = check.registration().serviceId();
            if (interrupted) {
                check.future().cancel(true);
                continue;
            }
            CheckResult result;
            try {
                result = await(check, timeoutNanos);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                check.future().cancel(true);
                log.warn("Health check pass {} interrupted, remaining checks cancelled", pass);
                continue;
            }
            if (result.status() == HealthStatus.ERROR) {
                log.error("Health check failed for {}: {}", serviceId, result.message());
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - check.submittedAtNanos());
            metrics.recordCheck(serviceId, result.status(), elapsed);
            results.put(serviceId, result);
            recordFresh(check.registration(), result);
        }

        Map<String, CheckResult> ordered = new LinkedHashMap<>();
        for (ServiceRegistration registration : order) {
            CheckResult result = results.get(registration.serviceId());
            if (result != null) {
                ordered.put(registration.serviceId(), result);
            }
        }
        return Collections.unmodifiableMap(ordered);
    }

    private List<PendingCheck> submit(List<ServiceRegistration> registrations, long pass) {
        List<PendingCheck> pending = new ArrayList<>(registrations.size());
        ExecutorService pool = registrations.isEmpty() ? null : workers();
        for (ServiceRegistration registration : registrations) {
            String serviceId = registration.serviceId();
            long submittedAt = System.nanoTime();
            AtomicBoolean started = new AtomicBoolean();
            Future<CheckResult> future;
            try {
                future = pool.submit(() -> {
                    started.set(true);
                    return CheckLoggingContext.callWith(serviceId, pass,
                            () -> tracer.trace(serviceId, pass, registration.check()::check));
                });
            } catch (RejectedExecutionException e) {
                future = CompletableFuture.failedFuture(e);
            }
            pending.add(new PendingCheck(registration, future, submittedAt, started));
        }
        return pending;
    }

    /**
     * Waits for one check until its deadline, measured from submission, and converts every
     * failure into an ERROR result. A check still queued behind busy workers at its deadline is
     * cancelled and reported as not started.
     */
    private CheckResult await(PendingCheck check, long timeoutNanos) throws InterruptedException {
        String serviceId = check.registration().serviceId();
        long remaining = check.submittedAtNanos() + timeoutNanos - System.nanoTime();
        HealthCheckException failure;
        try {
            CheckResult result = check.future().get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
            if (result != null) {
                return result;
            }
            failure = new CheckExecutionException(serviceId, "check returned no result");
        } catch (TimeoutException e) {
            check.future().cancel(true);
            failure = check.started().get()
                    ? new CheckTimeoutException(serviceId, config.checkTimeout())
                    : CheckTimeoutException.notStarted(serviceId, config.checkTimeout());
        } catch (CancellationException e) {
            failure = new CheckExecutionException(serviceId, "check was cancelled");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            failure = cause instanceof HealthCheckException hce ? hce : new CheckExecutionException(serviceId, cause);
            log.debug("Health check for {} threw", serviceId, cause);
        }
        return CheckResult.fromFailure(failure, clock.instant());
    }

    private void recordFresh(ServiceRegistration registration, CheckResult result) {
        String serviceId = registration.serviceId();
        Optional<Alert> alert;
        stateLock.lock();
        try {
            Optional<ServiceRegistration> current = registry.get(serviceId);
            if (current.isEmpty() || current.get() != registration) {
                log.debug("Discarding result for {}: service was re-registered during the pass", serviceId);
                return;
            }
            BoundedHistory<CheckResult> history = histories.append(serviceId, result);
            cache.put(serviceId, result, clock.instant());
            alert = alerts.evaluate(serviceId, registration.displayName(), result, history);
        } finally {
            stateLock.unlock();
        }
        alert.ifPresent(this::dispatch);
    }

    private void recordCached(String serviceId, CheckResult result) {
        Optional<Alert> alert = Optional.empty();
        stateLock.lock();
        try {
            Optional<ServiceRegistration> registration = registry.get(serviceId);
            Optional<BoundedHistory<CheckResult>> history = histories.history(serviceId);
            if (registration.isPresent() && history.isPresent()) {
                alert = alerts.evaluate(serviceId, registration.get().displayName(), result, history.get());
            }
        } finally {
            stateLock.unlock();
        }
        alert.ifPresent(this::dispatch);
    }

    private void dispatch(Alert alert) {
        metrics.recordAlert(alert.serviceId());
        alerts.dispatch(alert);
    }

    // ── Background monitoring ──

    /**
     * Starts the background scheduler, which runs a pass immediately and then once per check
     * interval. Has no effect if monitoring is already running.
     */
    public void startMonitoring() {
        synchronized (lifecycleLock) {
            if (schedulerThread != null) {
                log.warn("Health monitoring is already running");
                return;
            }
            CountDownLatch signal = new CountDownLatch(1);
            Thread thread = new Thread(() -> monitoringLoop(signal), "health-monitor");
            thread.setDaemon(true);
            stopSignal = signal;
            schedulerThread = thread;
            thread.start();
        }
        log.info("Started health monitoring with {}s interval", config.checkInterval().toSeconds());
    }

    /**
     * Stops the background scheduler and waits for it at most the configured shutdown timeout.
     * A scheduler still in a pass past that bound is abandoned: the pass is left to finish or to
     * hit its per-check timeouts, and its results are still recorded.
     *
     * @return true if the scheduler exited within the bound or was not running
     */
    public boolean stopMonitoring() {
        Thread thread;
        CountDownLatch signal;
        ExecutorService pool;
        synchronized (lifecycleLock) {
            if (schedulerThread == null) {
                log.warn("Health monitoring is not running");
                return true;
            }
            thread = schedulerThread;
            signal = stopSignal;
            pool = workers;
            schedulerThread = null;
            stopSignal = null;
            workers = null;
        }
        signal.countDown();
        try {
            thread.join(config.shutdownTimeout().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        boolean exited = !thread.isAlive();
        if (!exited) {
            log.warn("Health monitor did not stop within {} ms, abandoning it", config.shutdownTimeout().toMillis());
        }
        if (pool != null) {
            pool.shutdown();
        }
        log.info("Stopped health monitoring");
        return exited;
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return schedulerThread != null;
        }
    }

    private void monitoringLoop(CountDownLatch signal) {
        long intervalNanos = config.checkInterval().toNanos();
        long next = System.nanoTime();
        while (signal.getCount() > 0) {
            try {
                runHealthChecks();
            } catch (RuntimeException e) {
                log.error("Error in health monitoring loop", e);
            }
            next += intervalNanos;
            long now = System.nanoTime();
            if (now - next > 0) {
                // overran at least one slot; skip the missed ones
                next = now + intervalNanos;
            }
            try {
                if (signal.await(next - now, TimeUnit.NANOSECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.debug("Health monitoring loop exited");
    }

    private ExecutorService workers() {
        synchronized (lifecycleLock) {
            if (workers == null) {
                workers = Executors.newFixedThreadPool(config.workerPoolSize(), new CheckThreadFactory());
            }
            return workers;
        }
    }

    /**
     * Stops monitoring if running and releases the worker pool.
     */
    @Override
    public void close() {
        if (isRunning()) {
            stopMonitoring();
        }
        ExecutorService pool;
        synchronized (lifecycleLock) {
            pool = workers;
            workers = null;
        }
        if (pool != null) {
            pool.shutdown();
        }
    }

    // ── Queries ──

    /**
     * Returns the latest known status of one service. Unregistered ids and services without
     * results yet come back as UNKNOWN with an explanatory message.
     */
    public ServiceStatus getServiceStatus(String serviceId) {
        stateLock.lock();
        try {
            return statusOf(serviceId, clock.instant());
        } finally {
            stateLock.unlock();
        }
    }

    /** Status of every registered service, in registration order. */
    public Map<String, ServiceStatus> getAllServiceStatuses() {
        stateLock.lock();
        try {
            return allStatuses(clock.instant());
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Aggregates all services into the worst individual status. With no services, or none
     * checked yet, the overall status is UNKNOWN.
     */
    public SystemStatus getOverallSystemStatus() {
        stateLock.lock();
        try {
            Instant now = clock.instant();
            Map<String, ServiceStatus> statuses = allStatuses(now);
            List<HealthStatus> values = new ArrayList<>(statuses.size());
            statuses.values().forEach(s -> values.add(s.status()));
            return new SystemStatus(HealthStatus.worstOf(values), now, statuses, statuses.size());
        } finally {
            stateLock.unlock();
        }
    }

    /** Retained results of a service, oldest first; empty for unknown ids. */
    public List<CheckResult> getHistory(String serviceId) {
        stateLock.lock();
        try {
            return histories.history(serviceId).map(BoundedHistory::snapshot).orElse(List.of());
        } finally {
            stateLock.unlock();
        }
    }

    public MonitorConfig config() {
        return config;
    }

    private Map<String, ServiceStatus> allStatuses(Instant now) {
        Map<String, ServiceStatus> statuses = new LinkedHashMap<>();
        for (ServiceRegistration registration : registry.all()) {
            statuses.put(registration.serviceId(), statusOf(registration.serviceId(), now));
        }
        return statuses;
    }

    private ServiceStatus statusOf(String serviceId, Instant now) {
        Optional<ServiceRegistration> registration = registry.get(serviceId);
        if (registration.isEmpty()) {
            return ServiceStatus.unknown(serviceId, null, null, "Unknown service: " + serviceId, now);
        }
        ServiceRegistration r = registration.get();
        Optional<BoundedHistory<CheckResult>> history = histories.history(serviceId).filter(h -> !h.isEmpty());
        if (history.isEmpty()) {
            return ServiceStatus.unknown(serviceId, r.displayName(), r.serviceUrl(),
                    "No health data for service: " + serviceId, now);
        }
        return ServiceStatus.from(r, history.get());
    }

    private static final class CheckThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "health-check-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    /**
     * Builder for {@link ServiceMonitor}. Defaults: {@link MonitorConfig#defaults()}, the system
     * UTC clock, a {@link SimpleMeterRegistry} and a no-op tracer.
     */
    public static final class Builder {

        private MonitorConfig config = MonitorConfig.defaults();
        private Clock clock = Clock.systemUTC();
        private MeterRegistry meterRegistry;
        private Tracer tracer;

        private Builder() {
        }

        public Builder config(MonitorConfig config) {
            if (config == null) {
                throw new IllegalArgumentException("config must not be null");
            }
            this.config = config;
            return this;
        }

        public Builder clock(Clock clock) {
            if (clock == null) {
                throw new IllegalArgumentException("clock must not be null");
            }
            this.clock = clock;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = tracer;
            return this;
        }

        public ServiceMonitor build() {
            return new ServiceMonitor(this);
        }
    }
}
