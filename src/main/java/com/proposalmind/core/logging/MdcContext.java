package com.proposalmind.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing proposal-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setAgent(String runId, String agentId, int level) {
        MDC.put("runId", runId);
        MDC.put("agentId", agentId);
        MDC.put("level", String.valueOf(level));
    }

    public static void setLevel(String runId, int level) {
        MDC.put("runId", runId);
        MDC.put("level", String.valueOf(level));
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("runId");
        MDC.remove("agentId");
        MDC.remove("level");
    }
}
