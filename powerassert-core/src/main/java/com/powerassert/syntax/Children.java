package com.powerassert.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

final class Children {

    private Children() {
    }

    /**
     * Flattens single elements and element lists into one child list, skipping absent
     * (null) parts.
     */
    static List<Syntax> of(Object... parts) {
        List<Syntax> children = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof Syntax syntax) {
                children.add(syntax);
            } else if (part instanceof List<?> list) {
                for (Object element : list) {
                    children.add((Syntax) element);
                }
            }
        }
        return Collections.unmodifiableList(children);
    }
}
