package com.powerassert;

import com.powerassert.syntax.Syntax;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only child-to-parent lookup for one tree, keyed by node identity and built in a
 * single top-down pass.
 */
public final class ParentIndex {

    private final Map<Syntax, Syntax> parents = new IdentityHashMap<>();

    private ParentIndex() {
    }

    public static ParentIndex of(Syntax root) {
        ParentIndex index = new ParentIndex();
        index.record(root);
        return index;
    }

    private void record(Syntax node) {
        for (Syntax child : node.children()) {
            parents.put(child, node);
            record(child);
        }
    }

    public Optional<Syntax> parentOf(Syntax node) {
        return Optional.ofNullable(parents.get(node));
    }
}
