package com.entity.sync.logging;

import com.entity.sync.core.model.OperationKind;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC wrapper for structured logging around sync operations.
 * Adds key-value pairs to the SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forMutation(entityId, OperationKind.UPDATE, seq)) {
 *     log.debug("Dispatching update");
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String ENTITY_ID = "entityId";
    public static final String OPERATION = "operation";
    public static final String OPERATION_SEQ = "operationSeq";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for dispatching or resolving a mutation.
     */
    public static LogContext forMutation(String entityId, OperationKind kind, long sequence) {
        LogContext ctx = new LogContext();
        ctx.put(ENTITY_ID, entityId);
        ctx.put(OPERATION, kind.name().toLowerCase());
        ctx.put(OPERATION_SEQ, Long.toString(sequence));
        return ctx;
    }

    /**
     * Creates a log context for conflict reconciliation.
     */
    public static LogContext forReconciliation(String entityId) {
        LogContext ctx = new LogContext();
        ctx.put(ENTITY_ID, entityId);
        ctx.put(OPERATION, "reconcile");
        return ctx;
    }

    /**
     * Creates a log context for list refreshes and other server-driven updates.
     */
    public static LogContext forRefresh(String operation) {
        LogContext ctx = new LogContext();
        ctx.put(OPERATION, operation);
        return ctx;
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
