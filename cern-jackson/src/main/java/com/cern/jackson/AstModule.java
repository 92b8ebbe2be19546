package com.cern.jackson;

import com.cern.ast.SyntaxTree;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;

/**
 * Jackson module that reads and writes {@link SyntaxTree}s. Trees are stored as
 * arena handles, so they need a serializer that resolves handles while
 * walking, and a deserializer that allocates nodes into a fresh arena.
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.cern", "cern-jackson"));
        addSerializer(SyntaxTree.class, new SyntaxTreeSerializer());
        addDeserializer(SyntaxTree.class, new SyntaxTreeDeserializer());
    }
}
