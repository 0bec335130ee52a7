package com.vivek.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys for run-scoped structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String ITEM_ID = "itemId";
    public static final String MODE = "mode";
    public static final String ITERATION = "iteration";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setItem(String runId, String itemId, String mode) {
        MDC.put(RUN_ID, runId);
        MDC.put(ITEM_ID, itemId);
        MDC.put(MODE, mode);
    }

    public static void setIteration(int iteration) {
        MDC.put(ITERATION, String.valueOf(iteration));
    }

    public static void clearItem() {
        MDC.remove(ITEM_ID);
        MDC.remove(MODE);
        MDC.remove(ITERATION);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        clearItem();
    }
}
