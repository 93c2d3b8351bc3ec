package de.mirkosertic.lawnotes.crawl;

/**
 * Counters of one crawl run.
 */
public record CrawlStatistics(
        long statutesFetched,
        long notesWritten,
        long referencesEnqueued,
        /** Queue items dropped because they were deeper than the depth limit. */
        long droppedByDepth,
        /** Queue items whose statute had already been visited. */
        long duplicatesSkipped,
        long resolutionFailures,
        long unresolvedEvents,
        long startTimeMs,
        long endTimeMs
) {
    public long elapsedTimeMs() {
        return endTimeMs - startTimeMs;
    }

    /**
     * Mutable counterpart filled while the crawl runs.
     */
    static final class Tracker {

        private long statutesFetched;
        private long notesWritten;
        private long referencesEnqueued;
        private long droppedByDepth;
        private long duplicatesSkipped;
        private long resolutionFailures;
        private final long startTimeMs = System.currentTimeMillis();

        void statuteFetched() {
            statutesFetched++;
        }

        void noteWritten() {
            notesWritten++;
        }

        void referencesEnqueued(final int count) {
            referencesEnqueued += count;
        }

        void droppedByDepth() {
            droppedByDepth++;
        }

        void duplicateSkipped() {
            duplicatesSkipped++;
        }

        void resolutionFailed() {
            resolutionFailures++;
        }

        CrawlStatistics finish(final long unresolvedEvents) {
            return new CrawlStatistics(statutesFetched, notesWritten, referencesEnqueued, droppedByDepth,
                    duplicatesSkipped, resolutionFailures, unresolvedEvents, startTimeMs,
                    System.currentTimeMillis());
        }
    }
}
