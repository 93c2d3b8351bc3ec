package de.mirkosertic.lawnotes.api;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.lawnotes.config.ApplicationConfig;
import de.mirkosertic.lawnotes.config.BuildInfo;
import de.mirkosertic.lawnotes.model.StatuteCandidate;
import de.mirkosertic.lawnotes.model.StatuteContents;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Client for version 2 of the e-Gov law API.
 * <p>
 * Rate limiting (429), server errors (5xx) and connection failures are retried with a linear
 * backoff of {@code backoff * attempt}. Any other unsuccessful status fails at once.
 */
public class EGovLawApiClient implements LawApi {

    private static final Logger logger = LoggerFactory.getLogger(EGovLawApiClient.class);

    private static final String LAWS_PATH = "api/2/laws";
    private static final String LAW_DATA_PATH = "api/2/law_data";
    private static final int TOO_MANY_REQUESTS = 429;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final HttpUrl baseUrl;
    private final int maxAttempts;
    private final long backoffMs;

    public EGovLawApiClient(final String baseUrl, final Duration timeout, final int maxAttempts, final long backoffMs) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.baseUrl = HttpUrl.get(stripTrailingSlashes(baseUrl));
        this.httpClient = new OkHttpClient.Builder()
                .callTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.maxAttempts = maxAttempts;
        this.backoffMs = backoffMs;
    }

    public static EGovLawApiClient fromConfig(final ApplicationConfig config) {
        return new EGovLawApiClient(config.getApiBaseUrl(), Duration.ofMillis(config.getTimeoutMs()),
                config.getRetryAttempts(), config.getRetryBackoffMs());
    }

    @Override
    public List<StatuteCandidate> search(final String title) throws LawApiException {
        final Map<String, String> query = new LinkedHashMap<>();
        query.put("law_title", title);
        final LawsResponse response = get(LAWS_PATH, query, LawsResponse.class);

        final List<StatuteCandidate> candidates = new ArrayList<>();
        final Set<String> seen = new HashSet<>();
        for (final LawsResponse.LawEntry entry : entries(response)) {
            final StatuteCandidate candidate = toCandidate(entry);
            if (candidate == null) {
                continue;
            }
            final String key = nullToEmpty(candidate.lawId()) + "|" + nullToEmpty(candidate.lawNum()) + "|"
                    + candidate.lawTitle();
            if (seen.add(key)) {
                candidates.add(candidate);
            }
        }
        logger.debug("Search for '{}' returned {} candidates", title, candidates.size());
        return candidates;
    }

    @Override
    public StatuteContents fetchContents(final StatuteCandidate candidate) throws LawApiException {
        final String idOrNum = isPresent(candidate.lawId()) ? candidate.lawId() : candidate.lawNum();
        if (idOrNum == null || idOrNum.isEmpty()) {
            throw new LawApiException("Neither law_id nor law_num known for " + candidate.lawTitle());
        }
        final Map<String, String> query = new LinkedHashMap<>();
        query.put("response_format", "json");
        query.put("law_full_text_format", "json");
        final LawDataResponse response = get(LAW_DATA_PATH + "/" + idOrNum, query, LawDataResponse.class);

        if (response.lawInfo() == null || response.revisionInfo() == null
                || response.revisionInfo().lawTitle() == null) {
            throw new LawApiException("law_data response lacks law_info/revision_info for " + idOrNum);
        }
        final JsonNode fullText = response.lawFullText();
        if (fullText == null || fullText.isNull() || fullText.isMissingNode()) {
            throw new LawApiException("law_data response lacks law_full_text for " + idOrNum);
        }
        final String text = LawTextFlattener.flatten(fullText);
        return new StatuteContents(response.lawInfo().lawId(), response.lawInfo().lawNum(),
                response.revisionInfo().lawTitle(), text, null);
    }

    @Override
    public ListingPage listPage(final int limit, final int offset) throws LawApiException {
        final Map<String, String> query = new LinkedHashMap<>();
        query.put("limit", Integer.toString(limit));
        query.put("offset", Integer.toString(offset));
        final LawsResponse response = get(LAWS_PATH, query, LawsResponse.class);

        final List<LawsResponse.LawEntry> entries = entries(response);
        final List<ListedStatute> page = new ArrayList<>();
        for (final LawsResponse.LawEntry entry : entries) {
            final StatuteCandidate candidate = toCandidate(entry);
            if (candidate != null) {
                page.add(new ListedStatute(candidate, entry.revisionInfo().abbrev()));
            }
        }
        if (page.size() < entries.size()) {
            logger.debug("Skipped {} untitled entries at offset {}", entries.size() - page.size(), offset);
        }
        return new ListingPage(page, entries.size());
    }

    private <T> T get(final String path, final Map<String, String> query, final Class<T> type)
            throws LawApiException {
        final HttpUrl.Builder urlBuilder = baseUrl.newBuilder().addPathSegments(path);
        query.forEach(urlBuilder::addQueryParameter);
        final HttpUrl url = urlBuilder.build();
        final Request request = new Request.Builder()
                .url(url)
                .header("Accept", "application/json")
                .header("User-Agent", BuildInfo.userAgent())
                .get()
                .build();

        @Nullable LawApiException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (final Response response = httpClient.newCall(request).execute()) {
                final int status = response.code();
                final ResponseBody responseBody = response.body();
                final String body = responseBody != null ? responseBody.string() : "";
                if (response.isSuccessful()) {
                    return parse(body, type, url);
                }
                if (status == TOO_MANY_REQUESTS || status >= 500) {
                    lastFailure = new LawApiException("API error " + status + " " + url, status, null);
                    logger.warn("API returned {} for {} (attempt {}/{})", status, url, attempt, maxAttempts);
                } else {
                    throw new LawApiException("API error " + status + " " + url + ": " + body, status, null);
                }
            } catch (final LawApiException e) {
                throw e;
            } catch (final IOException e) {
                lastFailure = new LawApiException("API call failed: " + url, e);
                logger.warn("API call to {} failed (attempt {}/{}): {}", url, attempt, maxAttempts, e.getMessage());
            }
            if (attempt < maxAttempts) {
                sleep(backoffMs * attempt);
            }
        }
        throw lastFailure != null ? lastFailure : new LawApiException("API call failed: " + url);
    }

    private <T> T parse(final String body, final Class<T> type, final HttpUrl url) throws LawApiException {
        try {
            return objectMapper.readValue(body, type);
        } catch (final IOException e) {
            throw new LawApiException("Could not parse JSON from " + url, e);
        }
    }

    private static List<LawsResponse.LawEntry> entries(final LawsResponse response) throws LawApiException {
        if (response.laws() == null) {
            throw new LawApiException("laws response lacks the 'laws' array");
        }
        return response.laws();
    }

    private static @Nullable StatuteCandidate toCandidate(final LawsResponse.LawEntry entry) {
        if (entry.revisionInfo() == null) {
            return null;
        }
        final String title = entry.revisionInfo().lawTitle();
        if (title == null || title.isBlank()) {
            return null;
        }
        final LawsResponse.LawInfo info = entry.lawInfo();
        return info == null
                ? new StatuteCandidate(null, null, title, null)
                : new StatuteCandidate(info.lawId(), info.lawNum(), title, info.promulgationDate());
    }

    private static void sleep(final long millis) throws LawApiException {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LawApiException("Interrupted while waiting to retry", e);
        }
    }

    private static boolean isPresent(final @Nullable String value) {
        return value != null && !value.isEmpty();
    }

    private static String nullToEmpty(final @Nullable String value) {
        return value == null ? "" : value;
    }

    private static String stripTrailingSlashes(final String url) {
        String result = url.trim();
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
