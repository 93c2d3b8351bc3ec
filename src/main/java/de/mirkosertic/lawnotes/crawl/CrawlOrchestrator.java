package de.mirkosertic.lawnotes.crawl;

import de.mirkosertic.lawnotes.api.LawApi;
import de.mirkosertic.lawnotes.config.ApplicationConfig;
import de.mirkosertic.lawnotes.dictionary.DictionaryStore;
import de.mirkosertic.lawnotes.dictionary.NameDictionary;
import de.mirkosertic.lawnotes.model.LawRef;
import de.mirkosertic.lawnotes.model.StatuteCandidate;
import de.mirkosertic.lawnotes.model.StatuteContents;
import de.mirkosertic.lawnotes.model.UnresolvedRef;
import de.mirkosertic.lawnotes.reference.LinkRewriter;
import de.mirkosertic.lawnotes.reference.ReferenceExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Breadth first crawl over statute citations, starting at one root statute.
 * <p>
 * Each queue item names a statute, its depth and the statute that cited it. An item is
 * <ul>
 *     <li>dropped when it is deeper than the depth limit,</li>
 *     <li>resolved to a statute (a failure aborts the run for the root and prunes the branch
 *     otherwise),</li>
 *     <li>dropped when its statute was already visited,</li>
 *     <li>fetched, written as a note, and its citations are queued one level deeper.</li>
 * </ul>
 * Fetch and write failures abort the run. At the end the unresolved citations are reported
 * and merged into the unresolved store, and the dictionary is saved if it learned something.
 * <p>
 * One instance runs one crawl. It owns the queue, the visited set and the event list, and
 * shares the dictionary only with its resolver.
 */
public class CrawlOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(CrawlOrchestrator.class);

    static final String RESOLUTION_FAILURE_CONTEXT = "参照先法令名の解決失敗";

    /**
     * One pending statute of the crawl.
     *
     * @param sourceTitle the statute whose text cited this one, the root cites itself
     */
    record QueueItem(String title, int depth, String sourceTitle) {
    }

    private final LawApi lawApi;
    private final NameDictionary dictionary;
    private final DictionaryStore dictionaryStore;
    private final UnresolvedRefStore unresolvedStore;
    private final CandidateResolver resolver;
    private final NoteWriter noteWriter;
    private final int maxDepth;

    private final List<UnresolvedRef> unresolvedEvents = new ArrayList<>();

    public CrawlOrchestrator(final LawApi lawApi,
                             final NameDictionary dictionary,
                             final DictionaryStore dictionaryStore,
                             final UnresolvedRefStore unresolvedStore,
                             final CandidateResolver resolver,
                             final NoteWriter noteWriter,
                             final int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        this.lawApi = lawApi;
        this.dictionary = dictionary;
        this.dictionaryStore = dictionaryStore;
        this.unresolvedStore = unresolvedStore;
        this.resolver = resolver;
        this.noteWriter = noteWriter;
        this.maxDepth = maxDepth;
    }

    /**
     * Wires a crawl from the configuration.
     */
    public static CrawlOrchestrator create(final ApplicationConfig config,
                                           final LawApi lawApi,
                                           final NameDictionary dictionary,
                                           final DictionaryStore dictionaryStore,
                                           final CandidateSelector selector) {
        final Clock clock = Clock.systemUTC();
        final CandidateResolver resolver = new CandidateResolver(lawApi, dictionary, config.isNonInteractive(), selector);
        final NoteWriter noteWriter = new NoteWriter(config.getOutputDir(), config.isNoOverwrite(),
                new LinkRewriter(dictionary::canonicalTitle), clock);
        return new CrawlOrchestrator(lawApi, dictionary, dictionaryStore,
                new UnresolvedRefStore(config.getUnresolvedPath(), clock), resolver, noteWriter, config.getMaxDepth());
    }

    /**
     * Runs the crawl.
     *
     * @throws ResolutionException if the root statute cannot be resolved
     * @throws IOException         if a statute cannot be fetched or a file cannot be written
     */
    public CrawlStatistics run(final String rootTitle) throws ResolutionException, IOException {
        final CrawlStatistics.Tracker tracker = new CrawlStatistics.Tracker();
        final Deque<QueueItem> queue = new ArrayDeque<>();
        final Set<String> visited = new HashSet<>();
        queue.add(new QueueItem(rootTitle, 0, rootTitle));

        while (!queue.isEmpty()) {
            final QueueItem item = queue.poll();
            if (item.depth() > maxDepth) {
                tracker.droppedByDepth();
                continue;
            }

            final StatuteCandidate candidate;
            try {
                candidate = resolver.resolve(item.title());
            } catch (final ResolutionException e) {
                if (item.depth() == 0) {
                    throw e;
                }
                tracker.resolutionFailed();
                unresolvedEvents.add(new UnresolvedRef(item.sourceTitle(), item.title(), RESOLUTION_FAILURE_CONTEXT));
                logger.warn("Skipping '{}' cited by {}: {} ({})", item.title(), item.sourceTitle(),
                        e.getMessage(), e.getReason());
                continue;
            }

            if (!visited.add(candidate.identityKey())) {
                tracker.duplicateSkipped();
                continue;
            }

            logger.info("fetching {} ({}) depth={}", candidate.lawTitle(), candidate.idDisplay(), item.depth());
            final StatuteContents contents = lawApi.fetchContents(candidate);
            tracker.statuteFetched();

            final NoteWriter.WrittenNote note = noteWriter.write(contents, item.depth());
            tracker.noteWritten();
            dictionary.register(contents.lawTitle(), contents.toDictionaryEntry());
            for (final String token : note.unresolvedTokens()) {
                unresolvedEvents.add(new UnresolvedRef(contents.lawTitle(), token, null));
            }

            final Set<LawRef> refs = ReferenceExtractor.extract(contents.text(), dictionary, contents.lawTitle());
            for (final LawRef ref : refs) {
                queue.add(new QueueItem(ref.lawTitle(), item.depth() + 1, ref.sourceLaw()));
            }
            tracker.referencesEnqueued(refs.size());
            logger.debug("{} cites {} statute articles", contents.lawTitle(), refs.size());
        }

        reportUnresolved();
        unresolvedStore.merge(unresolvedEvents);
        dictionaryStore.saveIfDirty(dictionary);

        final CrawlStatistics statistics = tracker.finish(unresolvedEvents.size());
        logger.info("Crawl finished: {} notes written, {} duplicates skipped, {} dropped by depth, "
                        + "{} unresolved in {} ms",
                statistics.notesWritten(), statistics.duplicatesSkipped(), statistics.droppedByDepth(),
                statistics.unresolvedEvents(), statistics.elapsedTimeMs());
        return statistics;
    }

    List<UnresolvedRef> getUnresolvedEvents() {
        return List.copyOf(unresolvedEvents);
    }

    private void reportUnresolved() {
        if (unresolvedEvents.isEmpty()) {
            return;
        }
        logger.warn("Unresolved references:");
        for (final UnresolvedRef ref : unresolvedEvents) {
            logger.warn("  - [{}] {}", ref.sourceLaw(), ref.alias());
        }
    }
}
