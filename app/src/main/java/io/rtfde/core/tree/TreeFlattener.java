package io.rtfde.core.tree;

import java.util.Objects;
import java.util.stream.Stream;

/**
 * Linearizes parse trees in pre-order so that tree state can be compared with sequence diffs.
 * Every call walks the tree again; the returned streams are lazy and single-use.
 */
public final class TreeFlattener {

    private TreeFlattener() {
    }

    /**
     * Emits the tree label, then each child: token debug strings, nested trees recursively, scalars via
     * {@link String#valueOf(Object)}.
     */
    public static Stream<String> flatten(Tree tree) {
        Objects.requireNonNull(tree, "tree");
        return Stream.concat(
                Stream.of(tree.label()),
                tree.children().stream().flatMap(TreeFlattener::flattenChild));
    }

    /**
     * Emits leaf payloads only: token values and raw scalars. Nested trees contribute their leaves without a
     * label.
     */
    public static Stream<Object> flattenValues(Tree tree) {
        Objects.requireNonNull(tree, "tree");
        return tree.children().stream().flatMap(TreeFlattener::flattenChildValue);
    }

    private static Stream<String> flattenChild(Object child) {
        if (child instanceof Token token) {
            return Stream.of(token.debugString());
        }
        if (child instanceof Tree nested) {
            return flatten(nested);
        }
        return Stream.of(String.valueOf(child));
    }

    private static Stream<Object> flattenChildValue(Object child) {
        if (child instanceof Tree nested) {
            return flattenValues(nested);
        }
        if (child instanceof Token token) {
            return Stream.of(token.value());
        }
        return Stream.of(child);
    }
}
