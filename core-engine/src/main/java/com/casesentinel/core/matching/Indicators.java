package com.casesentinel.core.matching;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Helpers for assembling indicator lists from analysts and intelligence
 * feeds.
 *
 * @since 1.0.0
 */
public final class Indicators {

    private static final char[] DELIMITERS = {',', ';', '|'};

    private Indicators() {
        // utility class — not instantiable
    }

    /**
     * @param indicator raw indicator
     * @return trimmed, lowercased form used for comparison; empty for
     *         {@code null}
     */
    public static String normalize(String indicator) {
        return indicator == null ? "" : indicator.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Merge analyst-supplied indicators with feed indicators.
     *
     * <p>
     * Entries equal under trim and case-fold are collapsed; the first
     * occurrence (in its original spelling) is kept and order is preserved.
     * Blank entries are dropped.
     * </p>
     *
     * @param known analyst indicators, may be {@code null}
     * @param osint feed indicators, may be {@code null}
     * @return unmodifiable combined list
     */
    public static List<String> combine(List<String> known, List<String> osint) {
        Set<String> seen = new HashSet<>();
        List<String> result = new ArrayList<>();
        for (List<String> list : List.of(nullToEmpty(known), nullToEmpty(osint))) {
            for (String indicator : list) {
                String key = normalize(indicator);
                if (!key.isEmpty() && seen.add(key)) {
                    result.add(indicator);
                }
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Split pasted indicator text.
     *
     * <p>
     * The text is split into lines; each line is split on the first of
     * {@code ,} {@code ;} {@code |} it contains, or kept whole. Entries are
     * trimmed and blanks dropped.
     * </p>
     *
     * @param text pasted text, may be {@code null}
     * @return indicators in input order
     */
    public static List<String> parse(String text) {
        List<String> result = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return result;
        }
        for (String line : text.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            char delimiter = firstDelimiterIn(trimmed);
            if (delimiter == 0) {
                result.add(trimmed);
                continue;
            }
            for (String part : trimmed.split(Pattern.quote(String.valueOf(delimiter)))) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
        }
        return result;
    }

    private static char firstDelimiterIn(String line) {
        for (char delimiter : DELIMITERS) {
            if (line.indexOf(delimiter) >= 0) {
                return delimiter;
            }
        }
        return 0;
    }

    private static List<String> nullToEmpty(List<String> list) {
        return list != null ? list : List.of();
    }
}
