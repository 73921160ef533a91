package com.powerassert.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.powerassert.CaptureRewriter;
import com.powerassert.syntax.CallExpr;
import com.powerassert.syntax.Expr;
import com.powerassert.syntax.IdentifierExpr;
import com.powerassert.syntax.MemberAccessExpr;
import com.powerassert.syntax.SequenceExpr;
import com.powerassert.syntax.Syntax;
import com.powerassert.syntax.Token;
import com.powerassert.syntax.TokenKind;
import org.junit.jupiter.api.Test;

import static com.powerassert.syntax.SyntaxFactory.*;
import static org.junit.jupiter.api.Assertions.*;

public class SyntaxModuleTest {

    private final ObjectMapper mapper = PowerAssertJackson.createObjectMapper();

    @Test
    void testTokenJson() throws Exception {
        Token token = new Token(TokenKind.IDENTIFIER, "value", " ", "");
        JsonNode json = mapper.readTree(mapper.writerFor(Syntax.class).writeValueAsString(token));

        assertEquals("Token", json.get("type").asText());
        assertEquals("IDENTIFIER", json.get("kind").asText());
        assertEquals("value", json.get("text").asText());
        assertEquals(" ", json.get("leadingTrivia").asText());
    }

    @Test
    void testOmitsAbsentParts() throws Exception {
        MemberAccessExpr member = implicitMember("none");
        JsonNode json = mapper.readTree(mapper.writerFor(Expr.class).writeValueAsString(member));

        assertEquals("MemberAccessExpr", json.get("type").asText());
        assertFalse(json.has("base"), "Implicit member should not carry a base");
        assertEquals("none", json.get("name").get("text").asText());
    }

    @Test
    void testSequenceRoundTrip() throws Exception {
        SequenceExpr sequence = sequence(identifier("a"), binaryOperator("=="), integerLiteral(1));
        String json = mapper.writerFor(Expr.class).writeValueAsString(sequence);

        Expr restored = mapper.readValue(json, Expr.class);

        assertInstanceOf(SequenceExpr.class, restored);
        assertEquals(sequence, restored);
        assertEquals("a == 1", restored.toSource());
    }

    @Test
    void testRewrittenTreeRoundTrip() throws Exception {
        Expr expression = sequence(
            call(memberAccess(identifier("list"), "contains"), stringLiteral("x")),
            binaryOperator("&&"),
            prefixOperator("!", identifier("empty")));
        Expr rewritten = new CaptureRewriter(expression, 0).rewrite();

        String json = mapper.writerFor(Expr.class).writeValueAsString(rewritten);
        Expr restored = mapper.readValue(json, Expr.class);

        assertEquals(rewritten, restored);
        assertEquals(rewritten.toSource(), restored.toSource());
    }

    @Test
    void testReadConcreteType() throws Exception {
        String json = """
            {
              "type": "IdentifierExpr",
              "identifier": { "type": "Token", "kind": "IDENTIFIER", "text": "answer" },
              "unknownField": true
            }
            """;

        IdentifierExpr identifier = mapper.readValue(json, IdentifierExpr.class);

        assertEquals("answer", identifier.identifier().text());
        assertEquals("", identifier.identifier().leadingTrivia());
        assertEquals("", identifier.identifier().trailingTrivia());
    }

    @Test
    void testCallWithoutTrailingClosure() throws Exception {
        CallExpr call = call(identifier("f"), integerLiteral(1), integerLiteral(2));
        String json = mapper.writerFor(Expr.class).writeValueAsString(call);

        assertFalse(json.contains("trailingClosure"), "Absent trailing closure should be omitted");
        assertEquals("f(1, 2)", mapper.readValue(json, Expr.class).toSource());
    }
}
