package com.cern.jackson;

import com.cern.ast.SyntaxTree;
import com.cern.json.AstJsonDeserializer;
import com.cern.json.AstJsonException;
import com.cern.json.AstJsonProvider;
import com.cern.json.AstJsonSerializer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this.mapper = CernJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(SyntaxTree tree) throws AstJsonException {
            try {
                return mapper.writeValueAsString(tree);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize syntax tree", e);
            }
        }

        @Override
        public String serializePretty(SyntaxTree tree) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize syntax tree", e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public SyntaxTree deserializeTree(String json) throws AstJsonException {
            try {
                return mapper.readValue(json, SyntaxTree.class);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to deserialize syntax tree", e);
            }
        }
    }
}
