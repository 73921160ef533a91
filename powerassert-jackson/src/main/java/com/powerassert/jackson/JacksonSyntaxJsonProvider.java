package com.powerassert.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.powerassert.json.SyntaxJsonDeserializer;
import com.powerassert.json.SyntaxJsonException;
import com.powerassert.json.SyntaxJsonProvider;
import com.powerassert.json.SyntaxJsonSerializer;
import com.powerassert.syntax.Expr;
import com.powerassert.syntax.Syntax;

/**
 * Jackson-based implementation of SyntaxJsonProvider.
 */
public class JacksonSyntaxJsonProvider implements SyntaxJsonProvider {

    private final ObjectMapper mapper;
    private final SyntaxJsonSerializer serializer;
    private final SyntaxJsonDeserializer deserializer;

    public JacksonSyntaxJsonProvider() {
        this.mapper = PowerAssertJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public SyntaxJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public SyntaxJsonDeserializer getDeserializer() {
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

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements SyntaxJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Syntax syntax) throws SyntaxJsonException {
            try {
                return mapper.writerFor(Syntax.class).writeValueAsString(syntax);
            } catch (Exception e) {
                throw new SyntaxJsonException("Failed to serialize syntax element", e);
            }
        }

        @Override
        public String serializePretty(Syntax syntax) throws SyntaxJsonException {
            try {
                return mapper.writerFor(Syntax.class).withDefaultPrettyPrinter().writeValueAsString(syntax);
            } catch (Exception e) {
                throw new SyntaxJsonException("Failed to serialize syntax element", e);
            }
        }
    }

    private static class JacksonDeserializer implements SyntaxJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Expr deserializeExpr(String json) throws SyntaxJsonException {
            try {
                return mapper.readValue(json, Expr.class);
            } catch (Exception e) {
                throw new SyntaxJsonException("Failed to deserialize Expr", e);
            }
        }

        @Override
        public <T extends Syntax> T deserialize(String json, Class<T> type) throws SyntaxJsonException {
            try {
                return mapper.readValue(json, type);
            } catch (Exception e) {
                throw new SyntaxJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
        }
    }
}
