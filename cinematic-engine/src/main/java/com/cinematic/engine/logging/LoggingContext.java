package com.cinematic.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC helper so every log line of a stage carries its correlation keys.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forStage(projectId, stageId, sceneNumber, attempt)) {
 *     log.info("Running stage"); // includes projectId, stageId, sceneNumber, attempt
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String PROJECT_ID = "projectId";
    public static final String STAGE_ID = "stageId";
    public static final String SCENE_NUMBER = "sceneNumber";
    public static final String ATTEMPT = "attempt";
    public static final String TRACE_ID = "traceId";

    private final boolean ownsTraceId;

    private LoggingContext(boolean ownsTraceId) {
        this.ownsTraceId = ownsTraceId;
    }

    /**
     * Context for project-level operations.
     */
    public static LoggingContext forProject(UUID projectId) {
        boolean owns = ensureTraceId();
        if (projectId != null) {
            MDC.put(PROJECT_ID, projectId.toString());
        }
        return new LoggingContext(owns);
    }

    /**
     * Context for one stage execution.
     */
    public static LoggingContext forStage(UUID projectId, String stageId, Integer sceneNumber, int attempt) {
        LoggingContext ctx = forProject(projectId);
        if (stageId != null) {
            MDC.put(STAGE_ID, stageId);
        }
        if (sceneNumber != null) {
            MDC.put(SCENE_NUMBER, String.valueOf(sceneNumber));
        }
        MDC.put(ATTEMPT, String.valueOf(attempt));
        return ctx;
    }

    public static String getProjectId() {
        return MDC.get(PROJECT_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static boolean ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
            return true;
        }
        return false;
    }

    @Override
    public void close() {
        MDC.remove(PROJECT_ID);
        MDC.remove(STAGE_ID);
        MDC.remove(SCENE_NUMBER);
        MDC.remove(ATTEMPT);
        if (ownsTraceId) {
            MDC.remove(TRACE_ID);
        }
    }
}
