package com.tracegroup.core.exception;

/**
 * Thrown when a serialized trace document cannot be read or written.
 */
public class TraceFormatException extends TraceGroupingException {
    
    public static final String ERROR_CODE = "TRACE_FORMAT";
    
    public TraceFormatException(String message) {
        super(ERROR_CODE, message);
    }
    
    public TraceFormatException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
