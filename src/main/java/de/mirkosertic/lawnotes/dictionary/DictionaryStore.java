package de.mirkosertic.lawnotes.dictionary;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.mirkosertic.lawnotes.model.DictionaryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.TreeMap;

/**
 * Reads and writes the name dictionary as a pretty printed JSON object
 * {@code {"<alias>": {"law_id": ..., "law_num": ..., "law_title": ...}}}.
 */
public class DictionaryStore {

    private static final Logger logger = LoggerFactory.getLogger(DictionaryStore.class);

    private static final TypeReference<TreeMap<String, DictionaryEntry>> ENTRIES_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Path path;

    public DictionaryStore(final Path path) {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT), path);
    }

    DictionaryStore(final ObjectMapper objectMapper, final Path path) {
        this.objectMapper = objectMapper;
        this.path = path;
    }

    /**
     * Loads the dictionary. A missing file is an empty dictionary.
     *
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public NameDictionary load() throws IOException {
        if (!Files.exists(path)) {
            logger.debug("Dictionary file does not exist yet: {}", path);
            return new NameDictionary();
        }
        try (final Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            final TreeMap<String, DictionaryEntry> entries = objectMapper.readValue(reader, ENTRIES_TYPE);
            logger.info("Loaded {} dictionary entries from {}", entries == null ? 0 : entries.size(), path);
            return entries == null ? new NameDictionary() : new NameDictionary(entries);
        } catch (final JsonProcessingException e) {
            throw new IOException("Failed to parse dictionary file: " + path, e);
        }
    }

    /**
     * Writes the dictionary unconditionally and marks it clean.
     */
    public void save(final NameDictionary dictionary) throws IOException {
        final Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (final Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            objectMapper.writeValue(writer, dictionary.entries());
        }
        dictionary.markClean();
        logger.info("Saved {} dictionary entries to {}", dictionary.size(), path);
    }

    /**
     * Writes the dictionary only when an alias was registered since it was loaded.
     *
     * @return true if the file was written
     */
    public boolean saveIfDirty(final NameDictionary dictionary) throws IOException {
        if (!dictionary.isDirty()) {
            logger.debug("Dictionary unchanged, not writing {}", path);
            return false;
        }
        save(dictionary);
        return true;
    }

    public Path getPath() {
        return path;
    }
}
