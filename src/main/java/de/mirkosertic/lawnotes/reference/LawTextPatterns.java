package de.mirkosertic.lawnotes.reference;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Compiled patterns for citations in statute text.
 * <p>
 * Numbers appear either as Arabic digits or as kanji numerals ({@code 第九十条}, {@code 第2条}),
 * so every numeric group accepts both.
 */
public final class LawTextPatterns {

    /** Arabic digits or kanji numerals. */
    public static final String NUMERAL = "[0-9一二三四五六七八九十百千〇]+";

    /** Words that end the name of a statute (Act, Cabinet Order, Ministerial Ordinance, ...). */
    public static final List<String> STATUTE_SUFFIXES = List.of("法", "法律", "政令", "省令", "府令", "規則", "条例", "条約");

    static final String STATUTE_SUFFIX = "(?:法|法律|政令|省令|府令|規則|条例|条約)";

    /**
     * Branch number of an inserted article, {@code の二} in {@code 第三条の二}. Branches start at two,
     * which keeps phrases like {@code 第五条の一部} out.
     */
    static final String BRANCH = "の(?:[二三四五六七八九十百2-9][0-9一二三四五六七八九十百千〇]*|1[0-9]+)";

    /**
     * A cross reference such as {@code 民法第九十条}. Group {@code law} holds the name fragment,
     * group {@code article} the article token. The name part is matched lazily so the first suffix
     * followed by an article token ends it. It may start well before the name itself.
     */
    public static final Pattern EXTERNAL_REFERENCE = Pattern.compile(
            "(?<law>[ぁ-んァ-ヶー一-龥A-Za-z0-9・（）()「」『』]{1,40}?" + STATUTE_SUFFIX + ")"
                    + "(?<article>第" + NUMERAL + "条(?:" + BRANCH + ")?)");

    /** A statute name inside an already trimmed fragment, used by the normalizer. */
    static final Pattern STATUTE_NAME_TOKEN = Pattern.compile(
            "[一-龥ァ-ヶーA-Za-z0-9・]{1,30}" + STATUTE_SUFFIX);

    /** A full statute number like {@code 昭和三十四年法律第百二十一号}. */
    static final Pattern STATUTE_NUMBER = Pattern.compile(
            "(?:明治|大正|昭和|平成|令和)[元0-9一二三四五六七八九十〇]+年[^第\\s]{1,20}第" + NUMERAL + "号");

    public static final Pattern ARTICLE = Pattern.compile("第(?<n>" + NUMERAL + ")条(?:" + BRANCH + ")?");
    public static final Pattern PARAGRAPH = Pattern.compile("第(?<n>" + NUMERAL + ")項");
    public static final Pattern ITEM = Pattern.compile("第(?<n>" + NUMERAL + ")号");

    /** An article token at the very start of a line, including branch numbers like {@code 第三条の二}. */
    static final Pattern ARTICLE_AT_LINE_START = Pattern.compile(
            "^(第" + NUMERAL + "条(?:" + BRANCH + ")?)");

    /** Relative citations that need discourse context to resolve. */
    public static final List<String> ANAPHORIC_CITATIONS = List.of("前条", "前項", "次条", "同条", "同項");

    private LawTextPatterns() {
    }

    static boolean endsWithStatuteSuffix(final String text) {
        for (final String suffix : STATUTE_SUFFIXES) {
            if (text.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }
}
