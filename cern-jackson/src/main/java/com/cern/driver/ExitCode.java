package com.cern.driver;

/**
 * Process exit codes of the cern driver.
 */
public enum ExitCode {
    /** Successful exit */
    SUCCESS(0),
    /** Reading the source, writing the output or starting the compiler failed */
    ERROR_IO(2),
    /** Tokenize or parse failure */
    ERROR_PARSER(3),
    /** Semantic error found while generating, or the external compiler rejected the output */
    ERROR_USER(4),
    /** Bad command line argument */
    ERROR_COMMAND(5),
    /** Internal error, e.g. the node arena ran out of space */
    ERROR_INTERNAL(90);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
