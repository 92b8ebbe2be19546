package com.cern.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory for ObjectMapper instances that can read and write syntax trees.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = CernJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(Parser.parse(source));
 * SyntaxTree tree = mapper.readValue(json, SyntaxTree.class);
 * </pre>
 */
public final class CernJackson {

    private CernJackson() {
        // Utility class
    }

    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        // Ignore unknown properties so documents can carry extra annotations
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());
        return mapper;
    }
}
