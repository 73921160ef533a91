package com.powerassert.jackson;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.powerassert.syntax.ArrayExpr;
import com.powerassert.syntax.BinaryOperatorExpr;
import com.powerassert.syntax.CallExpr;
import com.powerassert.syntax.ClosureExpr;
import com.powerassert.syntax.DictionaryElement;
import com.powerassert.syntax.DictionaryExpr;
import com.powerassert.syntax.Expr;
import com.powerassert.syntax.ForceUnwrapExpr;
import com.powerassert.syntax.IdentifierExpr;
import com.powerassert.syntax.InfixOperatorExpr;
import com.powerassert.syntax.KeyPathExpr;
import com.powerassert.syntax.ListElement;
import com.powerassert.syntax.LiteralExpr;
import com.powerassert.syntax.MacroExpansionExpr;
import com.powerassert.syntax.MemberAccessExpr;
import com.powerassert.syntax.OptionalChainingExpr;
import com.powerassert.syntax.PrefixOperatorExpr;
import com.powerassert.syntax.SequenceExpr;
import com.powerassert.syntax.SubscriptExpr;
import com.powerassert.syntax.Syntax;
import com.powerassert.syntax.TernaryExpr;
import com.powerassert.syntax.Token;
import com.powerassert.syntax.TupleExpr;
import com.powerassert.syntax.UnresolvedTernaryExpr;

import java.util.List;

/**
 * Jackson module that configures serialization/deserialization for the syntax tree.
 *
 * Every element is written as an object whose "type" property holds the simple name of
 * its record class; the remaining properties are the record components. Absent optional
 * parts (null components) are omitted.
 */
public class SyntaxModule extends SimpleModule {

    static final List<Class<? extends Syntax>> SYNTAX_TYPES = List.of(
        Token.class,
        ListElement.class,
        DictionaryElement.class,
        LiteralExpr.class,
        IdentifierExpr.class,
        MemberAccessExpr.class,
        SubscriptExpr.class,
        CallExpr.class,
        PrefixOperatorExpr.class,
        ForceUnwrapExpr.class,
        OptionalChainingExpr.class,
        BinaryOperatorExpr.class,
        InfixOperatorExpr.class,
        SequenceExpr.class,
        UnresolvedTernaryExpr.class,
        TernaryExpr.class,
        TupleExpr.class,
        ArrayExpr.class,
        DictionaryExpr.class,
        KeyPathExpr.class,
        MacroExpansionExpr.class,
        ClosureExpr.class
    );

    public SyntaxModule() {
        super("SyntaxModule", new Version(1, 0, 0, null, "com.powerassert", "powerassert-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Syntax.class, SyntaxMixin.class);
        context.setMixInAnnotations(Expr.class, SyntaxMixin.class);

        // Mixins on the interfaces are not reliably inherited, so every record gets one too
        for (Class<? extends Syntax> type : SYNTAX_TYPES) {
            context.setMixInAnnotations(type, SyntaxMixin.class);
            context.registerSubtypes(new NamedType(type, type.getSimpleName()));
        }
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
    private abstract static class SyntaxMixin {
    }
}
