package com.platform.discovery.observability;

import com.platform.discovery.model.InstanceKey;
import org.slf4j.MDC;

/**
 * MDC helpers so every log line written while polling carries the run and instance.
 */
public final class LoggingContext {
    
    public static final String MDC_RUN_ID = "runId";
    public static final String MDC_INSTANCE = "instance";
    
    private LoggingContext() {
    }
    
    /**
     * Set run context for the worker thread.
     */
    public static void setRunContext(String runId) {
        if (runId != null) {
            MDC.put(MDC_RUN_ID, runId);
        }
    }
    
    public static void clearRunContext() {
        MDC.remove(MDC_RUN_ID);
    }
    
    /**
     * Set the instance currently being polled.
     */
    public static void setInstanceContext(InstanceKey key) {
        MDC.put(MDC_INSTANCE, key.toString());
    }
    
    public static void clearInstanceContext() {
        MDC.remove(MDC_INSTANCE);
    }
}
