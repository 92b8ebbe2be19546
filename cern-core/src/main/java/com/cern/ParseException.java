package com.cern;

/**
 * A fatal parse error. The parser never recovers from one: the exception
 * unwinds the whole parse and no partial tree is returned.
 */
public class ParseException extends CompileException {
    private final String construct;

    /**
     * @param template  leading phrase, e.g. "missing"
     * @param construct what was expected, e.g. "expression"
     * @param line      line of the offending (or nearest) token
     */
    public ParseException(String template, String construct, int line) {
        super("[Parse Error] " + template + " " + construct + " on line " + line, line);
        this.construct = construct;
    }

    public static ParseException missing(String construct, int line) {
        return new ParseException("missing", construct, line);
    }

    public String getConstruct() {
        return construct;
    }
}
