package com.cern;

public class TokenizeException extends CompileException {
    private final String reason;

    public TokenizeException(String reason, int line) {
        super("[Error] " + reason + " on line " + line, line);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
