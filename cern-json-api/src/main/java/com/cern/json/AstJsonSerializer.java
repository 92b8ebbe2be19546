package com.cern.json;

import com.cern.ast.SyntaxTree;

/**
 * Writes a parsed program as JSON. Every node becomes an object tagged with
 * its {@code "type"}; arena handles are resolved, so the output is a plain
 * nested document.
 */
public interface AstJsonSerializer {

    /**
     * @throws AstJsonException if serialization fails
     */
    String serialize(SyntaxTree tree) throws AstJsonException;

    /**
     * Same as {@link #serialize(SyntaxTree)}, indented for reading.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(SyntaxTree tree) throws AstJsonException;
}
