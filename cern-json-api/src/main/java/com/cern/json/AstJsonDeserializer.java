package com.cern.json;

import com.cern.ast.SyntaxTree;

/**
 * Reads a JSON document produced by an {@link AstJsonSerializer} back into a
 * syntax tree. Nodes are allocated bottom-up in a fresh arena.
 */
public interface AstJsonDeserializer {

    /**
     * @param json the JSON document
     * @return the rebuilt tree
     * @throws AstJsonException if the document is malformed or names an unknown node type
     */
    SyntaxTree deserializeTree(String json) throws AstJsonException;
}
