package com.casesentinel.core.model;

import java.util.Locale;

/**
 * Column-name normalization shared by every dataset and row.
 *
 * <p>
 * Forensic tools export headers such as {@code "Event Time"},
 * {@code "Last-Modified"} or {@code "USER"}. They are all reduced to
 * lowercase-with-underscores ({@code event_time}, {@code last_modified},
 * {@code user}) so that conventional aliases can be looked up by name.
 * </p>
 *
 * @since 1.0.0
 */
public final class ColumnNames {

    private ColumnNames() {
        // utility class — not instantiable
    }

    /**
     * Normalize a column name.
     *
     * @param name raw header text; {@code null} is treated as empty
     * @return trimmed, lowercased name with spaces and hyphens replaced by
     *         underscores
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return name.trim()
                .toLowerCase(Locale.ROOT)
                .replace(' ', '_')
                .replace('-', '_');
    }
}
