package com.tracegroup.core.exception;

/**
 * Thrown when grouping options or the stage list are inconsistent.
 */
public class PipelineConfigurationException extends TraceGroupingException {
    
    public static final String ERROR_CODE = "INVALID_PIPELINE";
    
    public PipelineConfigurationException(String message) {
        super(ERROR_CODE, message);
    }
    
    public PipelineConfigurationException(String field, String reason) {
        super(ERROR_CODE, String.format("Invalid grouping configuration: %s - %s", field, reason));
    }
}
