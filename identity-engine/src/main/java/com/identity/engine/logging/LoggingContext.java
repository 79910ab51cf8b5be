package com.identity.engine.logging;

import org.slf4j.MDC;

import java.util.Map;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include the tenant and aggregate they concern.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forAggregate(tenantId, "user", userId)) {
 *     log.info("Adding machine"); // Automatically includes tenantId, aggregateId
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TENANT_ID = "tenantId";
    public static final String AGGREGATE_TYPE = "aggregateType";
    public static final String AGGREGATE_ID = "aggregateId";
    public static final String CLIENT_ID = "clientId";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for tenant-level operations.
     */
    public static LoggingContext forTenant(String tenantId) {
        LoggingContext ctx = new LoggingContext();
        if (tenantId != null) {
            MDC.put(TENANT_ID, tenantId);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for commands on one aggregate.
     */
    public static LoggingContext forAggregate(String tenantId, String aggregateType, String aggregateId) {
        LoggingContext ctx = forTenant(tenantId);
        if (aggregateType != null) {
            MDC.put(AGGREGATE_TYPE, aggregateType);
        }
        if (aggregateId != null) {
            MDC.put(AGGREGATE_ID, aggregateId);
        }
        return ctx;
    }

    /**
     * Create a logging context for client authentication.
     */
    public static LoggingContext forClient(String tenantId, String clientId) {
        LoggingContext ctx = forTenant(tenantId);
        if (clientId != null) {
            MDC.put(CLIENT_ID, clientId);
        }
        return ctx;
    }

    /**
     * Snapshot of the current context, to be handed to a background task.
     */
    public static Map<String, String> capture() {
        return MDC.getCopyOfContextMap();
    }

    /**
     * Install a captured context on the current thread. A null snapshot leaves the context empty.
     */
    public static void restore(Map<String, String> context) {
        if (context != null) {
            MDC.setContextMap(context);
        }
    }

    /**
     * Ensure a trace ID exists in the context.
     */
    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(TENANT_ID);
        MDC.remove(AGGREGATE_TYPE);
        MDC.remove(AGGREGATE_ID);
        MDC.remove(CLIENT_ID);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context, trace ID included. Call at the end of a background task.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
