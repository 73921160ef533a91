package com.powerassert.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for syntax trees.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = PowerAssertJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(expression);
 * Expr expression = mapper.readValue(json, Expr.class);
 * </pre>
 */
public final class PowerAssertJackson {

    private PowerAssertJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for syntax tree serialization/deserialization.
     *
     * The returned mapper:
     * - Handles polymorphic Syntax types via the "type" property
     * - Omits absent (null) optional parts such as a missing trailing comma
     * - Ignores unknown properties during deserialization
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new SyntaxModule());

        return mapper;
    }
}
