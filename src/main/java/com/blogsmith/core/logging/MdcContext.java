package com.blogsmith.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Blogsmith-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String STAGE = "stage";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setStage(String runId, String stage) {
        MDC.put(RUN_ID, runId);
        MDC.put(STAGE, stage);
    }

    public static void clearStage() {
        MDC.remove(STAGE);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(STAGE);
    }
}
