package com.goerdes.cfrecovery.exception;

/**
 * Base exception for failures while building or structuring the control flow
 * of a function.
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
