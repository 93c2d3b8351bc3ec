package de.mirkosertic.lawnotes.crawl;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.mirkosertic.lawnotes.model.UnresolvedRef;
import de.mirkosertic.lawnotes.model.UnresolvedRefRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Persists unresolved citations across runs as {@code {"items": [...]}}, one record per
 * (source statute, alias) pair. Records keep their triage status; a repeated occurrence only
 * bumps the counter and the last-seen timestamp.
 */
public class UnresolvedRefStore {

    private static final Logger logger = LoggerFactory.getLogger(UnresolvedRefStore.class);

    record StoredItems(@JsonProperty("items") List<UnresolvedRefRecord> items) {
    }

    private final ObjectMapper objectMapper;
    private final Path path;
    private final Clock clock;

    public UnresolvedRefStore(final Path path, final Clock clock) {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        this.path = path;
        this.clock = clock;
    }

    /**
     * @return the persisted records, empty if the file does not exist
     */
    public List<UnresolvedRefRecord> load() throws IOException {
        if (!Files.exists(path)) {
            return new ArrayList<>();
        }
        try (final Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            final StoredItems stored = objectMapper.readValue(reader, StoredItems.class);
            if (stored == null || stored.items() == null) {
                return new ArrayList<>();
            }
            return new ArrayList<>(stored.items());
        } catch (final JsonProcessingException e) {
            throw new IOException("Failed to parse unresolved reference file: " + path, e);
        }
    }

    /**
     * Merges the events of a run into the persisted records and writes the file. Nothing is
     * read or written when there are no events.
     *
     * @return the number of records in the written file, 0 if nothing was written
     */
    public int merge(final List<UnresolvedRef> events) throws IOException {
        if (events.isEmpty()) {
            return 0;
        }
        final List<UnresolvedRefRecord> records = load();
        final String now = DateTimeFormatter.ISO_INSTANT.format(Instant.now(clock));

        for (final UnresolvedRef event : events) {
            final int index = indexOf(records, event);
            if (index >= 0) {
                records.set(index, records.get(index).withOccurrence(event, now));
            } else {
                records.add(UnresolvedRefRecord.firstOccurrence(event, now));
            }
        }

        final Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (final Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            objectMapper.writeValue(writer, new StoredItems(records));
        }
        logger.info("Saved {} unresolved references ({} events this run) to {}", records.size(), events.size(), path);
        return records.size();
    }

    private static int indexOf(final List<UnresolvedRefRecord> records, final UnresolvedRef event) {
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i).matches(event)) {
                return i;
            }
        }
        return -1;
    }
}
