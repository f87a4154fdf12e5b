package com.tracegroup.core.exception;

/**
 * Base exception for all trace grouping errors.
 */
public class TraceGroupingException extends RuntimeException {
    
    private final String errorCode;
    
    public TraceGroupingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public TraceGroupingException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
