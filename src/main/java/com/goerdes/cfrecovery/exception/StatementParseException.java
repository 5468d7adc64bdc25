package com.goerdes.cfrecovery.exception;

/**
 * Thrown when a textual function listing contains a line that cannot be
 * turned into a statement.
 */
public class StatementParseException extends AnalysisException {

    /** 1-based line number of the offending line. */
    private final int line;

    public StatementParseException(String message, int line, Throwable cause) {
        super("line " + line + ": " + message, cause);
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
