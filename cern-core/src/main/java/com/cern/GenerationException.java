package com.cern;

/**
 * A semantic error found while emitting code, such as use of an undeclared variable.
 */
public class GenerationException extends CompileException {
    public GenerationException(String reason, int line) {
        super("[Generation Error] " + reason + " on line " + line, line);
    }
}
