package com.cern;

public class ExpectedTokenException extends ParseException {
    private final TokenType expected;

    public ExpectedTokenException(TokenType expected, int line) {
        super("missing", expected.displayName(), line);
        this.expected = expected;
    }

    public TokenType getExpected() {
        return expected;
    }
}
