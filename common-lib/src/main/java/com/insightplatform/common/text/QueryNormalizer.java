package com.insightplatform.common.text;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form for free-text search queries.
 *
 * <p>Steps, in order:
 * <ol>
 *   <li>NFKD decomposition, then removal of every combining mark
 *       (Latin diacritics and Hebrew niqqud alike)</li>
 *   <li>lowercase (root locale), after decomposition so compatibility letters
 *       such as {@code 𝐌} or {@code №} keep their Latin form</li>
 *   <li>every run of characters outside the Hebrew block, {@code a-z},
 *       {@code 0-9} and whitespace becomes a single space</li>
 *   <li>whitespace collapsed to one space, trimmed</li>
 * </ol>
 *
 * <p>{@code normalize(normalize(x)).equals(normalize(x))} holds for every input.
 * No Spring dependencies. No I/O.
 */
public final class QueryNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern DISALLOWED      = Pattern.compile("[^\\u0590-\\u05FFa-z0-9\\s]+");
    private static final Pattern WHITESPACE      = Pattern.compile("\\s+");

    private QueryNormalizer() {}

    /**
     * @param raw query text as typed; may be {@code null}
     * @return normalized query, {@code ""} for null or blank input
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String s = Normalizer.normalize(raw, Normalizer.Form.NFKD);
        s = COMBINING_MARKS.matcher(s).replaceAll("");
        s = s.toLowerCase(Locale.ROOT);
        s = DISALLOWED.matcher(s).replaceAll(" ");
        s = WHITESPACE.matcher(s).replaceAll(" ");
        return s.trim();
    }
}
