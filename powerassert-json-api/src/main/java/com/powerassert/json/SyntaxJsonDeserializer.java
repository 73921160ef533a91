package com.powerassert.json;

import com.powerassert.syntax.Expr;
import com.powerassert.syntax.Syntax;

/**
 * Interface for deserializing syntax trees from JSON.
 */
public interface SyntaxJsonDeserializer {

    /**
     * Deserializes a JSON string to an expression tree.
     *
     * @param json the JSON string to deserialize
     * @return the deserialized expression
     * @throws SyntaxJsonException if deserialization fails
     */
    Expr deserializeExpr(String json) throws SyntaxJsonException;

    /**
     * Deserializes a JSON string to a specific syntax element type.
     *
     * @param json the JSON string to deserialize
     * @param type the expected element type
     * @param <T> the element type
     * @return the deserialized element
     * @throws SyntaxJsonException if deserialization fails
     */
    <T extends Syntax> T deserialize(String json, Class<T> type) throws SyntaxJsonException;
}
