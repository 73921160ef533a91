package com.powerassert;

import com.powerassert.syntax.CallExpr;
import com.powerassert.syntax.Expr;
import com.powerassert.syntax.ForceUnwrapExpr;
import com.powerassert.syntax.MemberAccessExpr;
import com.powerassert.syntax.OptionalChainingExpr;
import com.powerassert.syntax.SubscriptExpr;
import com.powerassert.syntax.Syntax;
import com.powerassert.syntax.Token;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Context queries over a syntax tree.
 */
public final class TreeMatchers {

    private TreeMatchers() {
        // Utility class
    }

    /**
     * Walks parent links outward from {@code node} (the node itself excluded) and returns
     * the first ancestor of the given type.
     */
    public static <T extends Syntax> Optional<T> nearestAncestor(ParentIndex parents, Syntax node, Class<T> type) {
        Optional<Syntax> current = parents.parentOf(node);
        while (current.isPresent()) {
            Syntax candidate = current.get();
            if (type.isInstance(candidate)) {
                return Optional.of(type.cast(candidate));
            }
            current = parents.parentOf(candidate);
        }
        return Optional.empty();
    }

    /**
     * Pre-order search below {@code node} (the node itself excluded) for the first
     * element of the given type. Tokens are neither matched nor descended into.
     */
    public static <T extends Syntax> Optional<T> findDescendant(Syntax node, Class<T> type) {
        return findDescendant(node, type, candidate -> true);
    }

    /**
     * As {@link #findDescendant(Syntax, Class)}, matching only elements that also satisfy
     * {@code filter}.
     */
    public static <T extends Syntax> Optional<T> findDescendant(Syntax node, Class<T> type, Predicate<? super T> filter) {
        for (Syntax child : node.children()) {
            if (child instanceof Token) {
                continue;
            }
            if (type.isInstance(child) && filter.test(type.cast(child))) {
                return Optional.of(type.cast(child));
            }
            Optional<T> found = findDescendant(child, type, filter);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * Follows the postfix chain below {@code node} (member base, callee, unwrapped
     * operand) and returns the first link of the given type. Arguments and subscripts
     * are not searched, so {@code f(a?.b).count} has no optional chain on its spine.
     */
    public static <T extends Expr> Optional<T> findOnChain(Expr node, Class<T> type) {
        Expr current = chainBase(node);
        while (current != null) {
            if (type.isInstance(current)) {
                return Optional.of(type.cast(current));
            }
            current = chainBase(current);
        }
        return Optional.empty();
    }

    private static Expr chainBase(Expr link) {
        if (link instanceof MemberAccessExpr member) {
            return member.base();
        }
        if (link instanceof CallExpr call) {
            return call.callee();
        }
        if (link instanceof SubscriptExpr subscript) {
            return subscript.callee();
        }
        if (link instanceof ForceUnwrapExpr unwrap) {
            return unwrap.expression();
        }
        if (link instanceof OptionalChainingExpr chain) {
            return chain.expression();
        }
        return null;
    }
}
