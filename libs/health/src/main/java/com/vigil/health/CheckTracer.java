package com.vigil.health;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.concurrent.Callable;

/**
 * Wraps each check invocation in an OpenTelemetry span.
 * <p>
 * Only the OTel API is used here; exporters and samplers are configured by the hosting application.
 */
public final class CheckTracer {

    public static final String SPAN_NAME = "health.check";
    public static final String ATTR_SERVICE_ID = "service.id";
    public static final String ATTR_PASS = "health.pass";
    public static final String ATTR_STATUS = "health.status";

    private static final String INSTRUMENTATION_NAME = "vigil-health";

    private final Tracer tracer;

    public CheckTracer(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * A tracer whose spans are discarded.
     */
    public static CheckTracer noop() {
        return new CheckTracer(OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME));
    }

    /**
     * Runs a check inside a {@code health.check} span. The span is marked ERROR when the check
     * throws or reports {@link HealthStatus#ERROR}.
     *
     * @throws Exception whatever the check throws
     */
    public CheckResult trace(String serviceId, long pass, Callable<CheckResult> check) throws Exception {
        Span span = tracer.spanBuilder(SPAN_NAME)
                .setSpanKind(SpanKind.INTERNAL)
                .setAttribute(ATTR_SERVICE_ID, serviceId)
                .setAttribute(ATTR_PASS, pass)
                .startSpan();
        try (Scope ignored = span.makeCurrent()) {
            CheckResult result = check.call();
            if (result != null) {
                span.setAttribute(ATTR_STATUS, result.status().toString());
                if (result.status() == HealthStatus.ERROR) {
                    span.setStatus(StatusCode.ERROR, result.message());
                } else {
                    span.setStatus(StatusCode.OK);
                }
            }
            return result;
        } catch (Exception e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public Tracer tracer() {
        return tracer;
    }
}
