package de.mirkosertic.lawnotes.dictionary;

import de.mirkosertic.lawnotes.model.DictionaryEntry;
import de.mirkosertic.lawnotes.reference.TitleNormalizer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Maps normalized statute names, statute numbers and abbreviations to the statute they denote.
 * <p>
 * Keys are always outputs of {@link TitleNormalizer#normalize(String)}, so every surface form
 * of a citation hits the same key. An alias is never overwritten once registered: the first
 * identity learned for it wins. Every insertion marks the dictionary dirty, and only a dirty
 * dictionary is written back by {@link DictionaryStore#saveIfDirty}.
 * <p>
 * Keys are kept sorted, which makes the persisted file stable and breaks ties of the
 * containment lookup in favour of the lexicographically first key.
 */
public class NameDictionary {

    private static final Logger logger = LoggerFactory.getLogger(NameDictionary.class);

    private final TreeMap<String, DictionaryEntry> entries;
    private boolean dirty;

    public NameDictionary() {
        this.entries = new TreeMap<>();
    }

    /**
     * Wraps previously persisted entries. The result is not dirty.
     */
    public NameDictionary(final Map<String, DictionaryEntry> persisted) {
        this.entries = new TreeMap<>(persisted);
    }

    /**
     * Looks up a title the way a crawl queue item names it: by its normalized form, or
     * verbatim when it does not normalize.
     */
    public @Nullable DictionaryEntry lookup(final String title) {
        final String normalized = TitleNormalizer.normalize(title);
        return entries.get(normalized != null ? normalized : title);
    }

    /**
     * Resolves a citation fragment to a statute title: the fragment is normalized, a rejected
     * fragment resolves to null, everything else goes through {@link #canonicalTitle(String)}.
     */
    public @Nullable String resolveFragment(final String fragment) {
        final String normalized = TitleNormalizer.normalize(fragment);
        if (normalized == null) {
            return null;
        }
        return canonicalTitle(normalized);
    }

    /**
     * Title a note for an already normalized statute name is stored under.
     * <ol>
     *     <li>an exact key match returns the canonical title of its entry</li>
     *     <li>otherwise the longest key contained in the name wins</li>
     *     <li>otherwise the name itself is returned</li>
     * </ol>
     * The containment step can resolve a short name embedded in an unrelated longer one;
     * the length tie-break is the only guard against that.
     */
    public String canonicalTitle(final String normalizedTitle) {
        final DictionaryEntry exact = entries.get(normalizedTitle);
        if (exact != null) {
            return exact.lawTitle();
        }
        @Nullable String best = null;
        for (final String key : entries.keySet()) {
            if (normalizedTitle.contains(key) && (best == null || key.length() > best.length())) {
                best = key;
            }
        }
        if (best != null) {
            return entries.get(best).lawTitle();
        }
        return normalizedTitle;
    }

    /**
     * Registers an alias if it normalizes and is not yet known.
     *
     * @return true if the dictionary changed
     */
    public boolean register(final String alias, final DictionaryEntry entry) {
        final String key = TitleNormalizer.normalize(alias);
        if (key == null) {
            logger.debug("Alias '{}' does not name a statute, not registered", alias);
            return false;
        }
        if (entries.containsKey(key)) {
            return false;
        }
        entries.put(key, entry);
        dirty = true;
        logger.debug("Registered alias '{}' for {}", key, entry.lawTitle());
        return true;
    }

    public boolean registerAll(final Iterable<String> aliases, final DictionaryEntry entry) {
        boolean changed = false;
        for (final String alias : aliases) {
            changed |= register(alias, entry);
        }
        return changed;
    }

    /**
     * Removes all entries, used before rebuilding from the full listing. Always marks the
     * dictionary dirty so an empty rebuild is still written.
     */
    public void clear() {
        entries.clear();
        dirty = true;
    }

    public @Nullable DictionaryEntry get(final String key) {
        return entries.get(key);
    }

    public SortedMap<String, DictionaryEntry> entries() {
        return Collections.unmodifiableSortedMap(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isDirty() {
        return dirty;
    }

    void markClean() {
        dirty = false;
    }
}
