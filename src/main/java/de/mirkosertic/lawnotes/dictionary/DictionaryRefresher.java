package de.mirkosertic.lawnotes.dictionary;

import de.mirkosertic.lawnotes.api.LawApi;
import de.mirkosertic.lawnotes.api.LawApiException;
import de.mirkosertic.lawnotes.api.ListedStatute;
import de.mirkosertic.lawnotes.api.ListingPage;
import de.mirkosertic.lawnotes.model.DictionaryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills the name dictionary from the full statute listing.
 * <p>
 * For every listed statute the title, the statute number and each abbreviation become aliases.
 * Existing aliases are kept, so a refresh never replaces what a confirmed search taught.
 */
public class DictionaryRefresher {

    private static final Logger logger = LoggerFactory.getLogger(DictionaryRefresher.class);

    private final LawApi lawApi;
    private final int pageSize;

    public DictionaryRefresher(final LawApi lawApi, final int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        this.lawApi = lawApi;
        this.pageSize = pageSize;
    }

    /**
     * Pages through the listing until the API returns no more entries.
     *
     * @return true if at least one alias was added
     */
    public boolean refresh(final NameDictionary dictionary) throws LawApiException {
        boolean changed = false;
        int offset = 0;
        int statutes = 0;
        final int sizeBefore = dictionary.size();
        while (true) {
            final ListingPage page = lawApi.listPage(pageSize, offset);
            if (page.isLast()) {
                break;
            }
            for (final ListedStatute listed : page.statutes()) {
                changed |= register(dictionary, listed);
            }
            statutes += page.statutes().size();
            offset += pageSize;
            logger.debug("Scanned {} statutes, dictionary has {} entries", statutes, dictionary.size());
        }
        logger.info("Dictionary refresh scanned {} statutes and added {} aliases",
                statutes, dictionary.size() - sizeBefore);
        return changed;
    }

    private static boolean register(final NameDictionary dictionary, final ListedStatute listed) {
        final DictionaryEntry entry = listed.candidate().toDictionaryEntry();
        boolean changed = dictionary.register(listed.candidate().lawTitle(), entry);
        final String lawNum = listed.candidate().lawNum();
        if (lawNum != null && !lawNum.isBlank()) {
            changed |= dictionary.register(lawNum, entry);
        }
        changed |= dictionary.registerAll(listed.abbreviations(), entry);
        return changed;
    }
}
