package com.cern;

/**
 * Base class for every user-facing failure of the front end. The message is
 * the complete one-line diagnostic printed by the driver.
 */
public abstract class CompileException extends RuntimeException {
    private final int line;

    protected CompileException(String message, int line) {
        super(message);
        this.line = line;
    }

    /**
     * Source line the diagnostic refers to, or 0 if unknown.
     */
    public int getLine() {
        return line;
    }
}
