package com.vigil.health;

import org.slf4j.MDC;

import java.util.concurrent.Callable;

/**
 * Populates the SLF4J MDC while a check runs on a worker thread, so log lines emitted by the
 * check carry the service id and pass number.
 */
public final class CheckLoggingContext {

    public static final String MDC_SERVICE_ID = "serviceId";
    public static final String MDC_CHECK_PASS = "checkPass";

    private CheckLoggingContext() {
    }

    /**
     * Calls the task with the MDC keys set, then restores whatever values they had before.
     */
    public static <T> T callWith(String serviceId, long pass, Callable<T> task) throws Exception {
        String previousService = MDC.get(MDC_SERVICE_ID);
        String previousPass = MDC.get(MDC_CHECK_PASS);
        MDC.put(MDC_SERVICE_ID, serviceId);
        MDC.put(MDC_CHECK_PASS, Long.toString(pass));
        try {
            return task.call();
        } finally {
            restore(MDC_SERVICE_ID, previousService);
            restore(MDC_CHECK_PASS, previousPass);
        }
    }

    private static void restore(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
