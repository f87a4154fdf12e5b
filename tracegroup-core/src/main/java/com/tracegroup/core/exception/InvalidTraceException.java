package com.tracegroup.core.exception;

/**
 * Thrown when a trace handed to the grouping pipeline is structurally unusable.
 * Raised before any pass runs; never raised for missing stats.
 */
public class InvalidTraceException extends TraceGroupingException {
    
    public static final String ERROR_CODE = "INVALID_TRACE";
    
    public InvalidTraceException(String message) {
        super(ERROR_CODE, message);
    }
    
    public InvalidTraceException(String location, String reason) {
        super(ERROR_CODE, String.format("Invalid trace: %s - %s", location, reason));
    }
}
