package io.rtfde.core.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Parse tree node. Children are nested {@link Tree}s, {@link Token}s, or opaque scalars.
 */
public record Tree(String tag, List<Object> children) {

    public Tree {
        Objects.requireNonNull(tag, "tag");
        children = children == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(children));
    }

    public static Tree of(String tag, Object... children) {
        List<Object> list = new ArrayList<>(children.length);
        Collections.addAll(list, children);
        return new Tree(tag, list);
    }

    public String label() {
        return "Tree('" + tag + "')";
    }
}
