package de.mirkosertic.lawnotes.api;

import com.fasterxml.jackson.databind.JsonNode;
import de.mirkosertic.lawnotes.util.TextCleaner;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts the {@code law_full_text} tree into plain text with one structural block per line.
 * <p>
 * Leaf strings are concatenated as they are. Block elements (articles, paragraphs, chapters, ...)
 * start and end on a line of their own; inline elements like {@code Sentence} or {@code Ruby}
 * flow into the surrounding text.
 */
public final class LawTextFlattener {

    static final Set<String> BLOCK_TAGS = Set.of(
            "Law", "LawBody", "MainProvision", "Part", "Chapter", "Section", "Subsection",
            "Division", "Article", "Paragraph", "Item", "Subitem", "SupplProvision",
            "AppdxTable", "AppdxNote", "AppdxStyle", "Appdx");

    private static final String TAG_FIELD = "tag";
    private static final String ATTRIBUTES_FIELD = "attr";
    private static final String CHILDREN_FIELD = "children";

    private LawTextFlattener() {
    }

    /**
     * Builds the node tree from the JSON representation. Numbers, booleans and nulls carry no
     * statute text and become empty sequences.
     */
    public static LawTextNode parse(final JsonNode json) {
        if (json.isTextual()) {
            return new LawTextNode.Leaf(json.textValue());
        }
        if (json.isArray()) {
            final List<LawTextNode> children = new ArrayList<>(json.size());
            for (final JsonNode child : json) {
                children.add(parse(child));
            }
            return new LawTextNode.Sequence(children);
        }
        if (json.isObject()) {
            final String tag = json.path(TAG_FIELD).asText("");
            final List<LawTextNode> children = new ArrayList<>();
            final JsonNode explicitChildren = json.get(CHILDREN_FIELD);
            if (explicitChildren != null) {
                children.add(parse(explicitChildren));
            } else {
                final Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
                while (fields.hasNext()) {
                    final Map.Entry<String, JsonNode> field = fields.next();
                    if (!TAG_FIELD.equals(field.getKey()) && !ATTRIBUTES_FIELD.equals(field.getKey())) {
                        children.add(parse(field.getValue()));
                    }
                }
            }
            return new LawTextNode.Element(tag, children);
        }
        return new LawTextNode.Sequence(List.of());
    }

    /**
     * Flattens a parsed tree and normalizes its layout.
     *
     * @throws LawApiException if no text is left
     */
    public static String flatten(final LawTextNode root) throws LawApiException {
        final StringBuilder out = new StringBuilder();
        append(root, out);
        final String text = TextCleaner.normalizeLines(out.toString());
        if (text.isEmpty()) {
            throw new LawApiException("No text could be extracted from law_full_text");
        }
        return text;
    }

    public static String flatten(final JsonNode json) throws LawApiException {
        return flatten(parse(json));
    }

    private static void append(final LawTextNode node, final StringBuilder out) {
        if (node instanceof LawTextNode.Leaf leaf) {
            out.append(TextCleaner.removeInvalidCharacters(leaf.text()));
        } else if (node instanceof LawTextNode.Sequence sequence) {
            for (final LawTextNode child : sequence.children()) {
                append(child, out);
            }
        } else if (node instanceof LawTextNode.Element element) {
            final boolean block = BLOCK_TAGS.contains(element.tag());
            if (block) {
                breakLine(out);
            }
            for (final LawTextNode child : element.children()) {
                append(child, out);
            }
            if (block) {
                breakLine(out);
            }
        }
    }

    private static void breakLine(final StringBuilder out) {
        if (out.length() == 0 || out.charAt(out.length() - 1) != '\n') {
            out.append('\n');
        }
    }
}
