package de.mirkosertic.lawnotes.reference;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Reduces a text fragment to the statute name it cites.
 * <p>
 * Fragments come from greedy pattern matches over running text, so they often carry
 * surrounding noise: brackets, amendment qualifiers ({@code 旧}, {@code 改正後}),
 * leaked article numbers or a connective ({@code 中}) in front of the real name.
 * Self references like {@code 同法} are rejected because they only make sense with
 * discourse context.
 * <p>
 * Every key of the name dictionary is an output of {@link #normalize(String)}.
 */
public final class TitleNormalizer {

    private static final String TRIM_CHARACTERS = " 　（）()「」『』、。";
    private static final String LEADING_NOISE = "一二三四五六七八九十百千〇0123456789第条項号";
    private static final String CONNECTIVE = "中";

    private static final Set<String> ANAPHORIC_TITLES = Set.of("同法", "同法律", "この法律", "本法", "前記法");
    private static final List<String> QUALIFIERS = List.of("改正前", "改正後", "旧", "新");

    private TitleNormalizer() {
    }

    /**
     * @return the statute name, or null when the fragment does not name a concrete statute
     */
    public static @Nullable String normalize(final String fragment) {
        final String trimmed = trim(fragment);
        if (trimmed.isEmpty() || ANAPHORIC_TITLES.contains(trimmed)) {
            return null;
        }
        if (LawTextPatterns.STATUTE_NUMBER.matcher(trimmed).matches()) {
            return trimmed;
        }

        final String last = lastStatuteName(trimmed);
        if (last == null) {
            return null;
        }

        String token = stripQualifier(last);
        token = stripLeadingNoise(token);
        if (token.startsWith(CONNECTIVE)) {
            token = token.substring(CONNECTIVE.length());
        }
        token = stripQualifier(token);

        // "...中特許法": keep the statute on the right of the last connective
        final int connective = token.lastIndexOf(CONNECTIVE);
        if (connective >= 0) {
            final String right = token.substring(connective + CONNECTIVE.length());
            if (LawTextPatterns.endsWithStatuteSuffix(right)) {
                token = right;
            }
        }

        if (ANAPHORIC_TITLES.contains(token)) {
            return null;
        }
        if (token.codePointCount(0, token.length()) < 2) {
            return null;
        }
        return token;
    }

    private static @Nullable String lastStatuteName(final String text) {
        final Matcher matcher = LawTextPatterns.STATUTE_NAME_TOKEN.matcher(text);
        @Nullable String last = null;
        while (matcher.find()) {
            last = matcher.group();
        }
        return last;
    }

    private static String trim(final String value) {
        int start = 0;
        int end = value.length();
        while (start < end && TRIM_CHARACTERS.indexOf(value.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && TRIM_CHARACTERS.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(start, end);
    }

    private static String stripQualifier(final String token) {
        for (final String qualifier : QUALIFIERS) {
            if (token.startsWith(qualifier)) {
                return token.substring(qualifier.length());
            }
        }
        return token;
    }

    private static String stripLeadingNoise(final String token) {
        int start = 0;
        while (start < token.length() && LEADING_NOISE.indexOf(token.charAt(start)) >= 0) {
            start++;
        }
        return token.substring(start);
    }
}
