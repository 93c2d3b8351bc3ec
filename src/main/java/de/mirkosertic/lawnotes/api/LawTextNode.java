package de.mirkosertic.lawnotes.api;

import java.util.List;

/**
 * Node of the statute document tree delivered as {@code law_full_text}.
 */
public interface LawTextNode {

    /** Literal text. */
    record Leaf(String text) implements LawTextNode {
    }

    /** Untagged list of nodes, a JSON array. */
    record Sequence(List<LawTextNode> children) implements LawTextNode {
    }

    /** Tagged node such as {@code Article} or {@code Sentence}. */
    record Element(String tag, List<LawTextNode> children) implements LawTextNode {
    }
}
