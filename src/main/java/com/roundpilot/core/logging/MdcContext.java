package com.roundpilot.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing roundpilot MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String SOURCE_ID = "sourceId";
    public static final String REQUEST_ID = "requestId";
    public static final String COMPONENT = "component";

    private MdcContext() {}

    public static void setSource(String sourceId) {
        MDC.put(SOURCE_ID, sourceId);
    }

    public static void setComponent(String component) {
        MDC.put(COMPONENT, component);
    }

    public static void setRequest(String sourceId, String requestId) {
        MDC.put(SOURCE_ID, sourceId);
        MDC.put(REQUEST_ID, requestId);
    }

    public static void clearRequest() {
        MDC.remove(SOURCE_ID);
        MDC.remove(REQUEST_ID);
    }

    public static void clear() {
        MDC.remove(SOURCE_ID);
        MDC.remove(REQUEST_ID);
        MDC.remove(COMPONENT);
    }
}
