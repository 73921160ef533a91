package com.powerassert.json;

import com.powerassert.syntax.Syntax;

/**
 * Interface for serializing syntax trees to JSON.
 */
public interface SyntaxJsonSerializer {

    /**
     * Serializes a syntax element to a JSON string.
     *
     * @param syntax the element to serialize
     * @return the JSON representation
     * @throws SyntaxJsonException if serialization fails
     */
    String serialize(Syntax syntax) throws SyntaxJsonException;

    /**
     * Serializes a syntax element to a pretty-printed JSON string.
     *
     * @param syntax the element to serialize
     * @return the pretty-printed JSON representation
     * @throws SyntaxJsonException if serialization fails
     */
    String serializePretty(Syntax syntax) throws SyntaxJsonException;
}
