package com.goerdes.cfrecovery.exception;

/**
 * Thrown when blocks handed to a structured construct do not have the shape
 * the construct requires.
 */
public class MalformedStructureException extends AnalysisException {

    public MalformedStructureException(String message) {
        super(message, null);
    }
}
