package de.mirkosertic.lawnotes;

import de.mirkosertic.lawnotes.api.EGovLawApiClient;
import de.mirkosertic.lawnotes.api.LawApi;
import de.mirkosertic.lawnotes.config.ApplicationConfig;
import de.mirkosertic.lawnotes.config.BuildInfo;
import de.mirkosertic.lawnotes.config.LoggingConfigurator;
import de.mirkosertic.lawnotes.crawl.CandidateSelector;
import de.mirkosertic.lawnotes.crawl.ConsoleCandidateSelector;
import de.mirkosertic.lawnotes.crawl.CrawlOrchestrator;
import de.mirkosertic.lawnotes.crawl.CrawlStatistics;
import de.mirkosertic.lawnotes.crawl.ResolutionException;
import de.mirkosertic.lawnotes.dictionary.DictionaryRefresher;
import de.mirkosertic.lawnotes.dictionary.DictionaryStore;
import de.mirkosertic.lawnotes.dictionary.NameDictionary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Command line entry point: fetches a statute and the statutes it cites, and writes them as
 * linked Markdown notes.
 * <p>
 * Exit codes: 0 on success, 1 on a fatal error, 2 if the root statute cannot be resolved.
 */
@Command(name = "lawnotes",
        mixinStandardHelpOptions = true,
        versionProvider = BuildInfo.VersionProvider.class,
        exitCodeOnInvalidInput = LawNotesApplication.EXIT_FATAL,
        description = "Fetches a statute from the e-Gov law API and writes it and the statutes it cites as linked notes.")
public class LawNotesApplication implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(LawNotesApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_UNRESOLVED_ROOT = 2;

    @Parameters(index = "0", arity = "0..1", paramLabel = "LAW_TITLE", description = "Title of the root statute")
    String lawTitle;

    @Option(names = "--output-dir", description = "Directory for the notes (default: laws)")
    String outputDir;

    @Option(names = "--max-depth", description = "Maximum citation depth to follow (default: 2)")
    Integer maxDepth;

    @Option(names = "--no-overwrite", description = "Fail instead of replacing an existing note")
    boolean noOverwrite;

    @Option(names = "--api-base-url", description = "Base URL of the law API")
    String apiBaseUrl;

    @Option(names = "--non-interactive", description = "Never prompt; ambiguous names fail")
    boolean nonInteractive;

    @Option(names = "--dict-path", description = "Name dictionary file")
    String dictPath;

    @Option(names = "--unresolved-path", description = "Unresolved reference file")
    String unresolvedPath;

    @Option(names = "--refresh-dictionary", description = "Add all listed statutes to the dictionary before crawling")
    boolean refreshDictionary;

    @Option(names = "--build-dictionary", description = "Rebuild the dictionary from the full listing")
    boolean buildDictionary;

    @Option(names = "--retry", description = "Attempts per API request (default: 3)")
    Integer retryAttempts;

    @Option(names = "--timeout-ms", description = "Timeout per API request in milliseconds (default: 30000)")
    Long timeoutMs;

    @Option(names = "--verbose", description = "Log debug output")
    boolean verbose;

    @Option(names = "--log-file", description = "Log to ~/.lawnotes/log instead of the terminal")
    boolean logFile;

    private final Function<ApplicationConfig, LawApi> lawApiFactory;
    private final CandidateSelector candidateSelector;

    public LawNotesApplication() {
        this(EGovLawApiClient::fromConfig, new ConsoleCandidateSelector());
    }

    LawNotesApplication(final Function<ApplicationConfig, LawApi> lawApiFactory,
                        final CandidateSelector candidateSelector) {
        this.lawApiFactory = lawApiFactory;
        this.candidateSelector = candidateSelector;
    }

    @Override
    public Integer call() {
        LoggingConfigurator.configure(logFile, verbose);
        try {
            final ApplicationConfig config = ApplicationConfig.load();
            applyOptions(config);
            return run(config);
        } catch (final ResolutionException e) {
            logger.error("Could not resolve '{}' ({}): {}", e.getTitle(), e.getReason(), e.getMessage());
            return EXIT_UNRESOLVED_ROOT;
        } catch (final IOException | IllegalArgumentException e) {
            logger.error("lawnotes failed: {}", e.getMessage(), e);
            return EXIT_FATAL;
        }
    }

    void applyOptions(final ApplicationConfig config) {
        if (outputDir != null) {
            config.setOutputDir(outputDir);
        }
        if (maxDepth != null) {
            config.setMaxDepth(maxDepth);
        }
        if (noOverwrite) {
            config.setNoOverwrite(true);
        }
        if (apiBaseUrl != null) {
            config.setApiBaseUrl(apiBaseUrl);
        }
        if (nonInteractive) {
            config.setNonInteractive(true);
        }
        if (dictPath != null) {
            config.setDictionaryPath(dictPath);
        }
        if (unresolvedPath != null) {
            config.setUnresolvedPath(unresolvedPath);
        }
        if (retryAttempts != null) {
            config.setRetryAttempts(retryAttempts);
        }
        if (timeoutMs != null) {
            config.setTimeoutMs(timeoutMs);
        }
    }

    private int run(final ApplicationConfig config) throws ResolutionException, IOException {
        final LawApi lawApi = lawApiFactory.apply(config);
        final DictionaryStore dictionaryStore = new DictionaryStore(config.getDictionaryPath());
        final NameDictionary dictionary = dictionaryStore.load();

        if (refreshDictionary || buildDictionary) {
            logger.info("Updating dictionary from the statute listing");
            if (buildDictionary) {
                dictionary.clear();
            }
            final boolean changed = new DictionaryRefresher(lawApi, config.getListingPageSize()).refresh(dictionary);
            if (changed || buildDictionary) {
                dictionaryStore.save(dictionary);
            }
        }

        if (lawTitle == null || lawTitle.isBlank()) {
            if (buildDictionary) {
                return EXIT_OK;
            }
            logger.error("No statute title given (use --build-dictionary to only rebuild the dictionary)");
            return EXIT_FATAL;
        }

        final CrawlOrchestrator orchestrator = CrawlOrchestrator.create(config, lawApi, dictionary, dictionaryStore,
                candidateSelector);
        final CrawlStatistics statistics = orchestrator.run(lawTitle.trim());
        logger.info("Fetched {} statutes, {} citations queued, {} resolution failures",
                statistics.statutesFetched(), statistics.referencesEnqueued(), statistics.resolutionFailures());
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        System.exit(new CommandLine(new LawNotesApplication()).execute(args));
    }
}
