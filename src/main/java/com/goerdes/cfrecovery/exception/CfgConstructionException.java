package com.goerdes.cfrecovery.exception;

/**
 * Thrown when the statements of a function cannot be wired into a control
 * flow graph, e.g. a branch targets an offset outside the function.
 */
public class CfgConstructionException extends AnalysisException {

    public CfgConstructionException(String message) {
        super(message, null);
    }
}
