package de.mirkosertic.lawnotes.reference;

import de.mirkosertic.lawnotes.dictionary.NameDictionary;
import de.mirkosertic.lawnotes.model.LawRef;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Finds citations of other statutes ({@code 民法第九十条}) in a statute body.
 * <p>
 * The cited name is resolved through the dictionary where possible. Repeated citations of the
 * same article collapse into one reference, and the result keeps the order of first occurrence
 * so the crawl order is reproducible.
 */
public final class ReferenceExtractor {

    private ReferenceExtractor() {
    }

    public static Set<LawRef> extract(final String text, final NameDictionary dictionary, final String sourceTitle) {
        final Set<LawRef> refs = new LinkedHashSet<>();
        final Matcher matcher = LawTextPatterns.EXTERNAL_REFERENCE.matcher(text);
        while (matcher.find()) {
            final String title = dictionary.resolveFragment(matcher.group("law"));
            if (title != null) {
                refs.add(new LawRef(sourceTitle, title, matcher.group("article")));
            }
        }
        return refs;
    }
}
