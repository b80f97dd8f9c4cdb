package com.casesentinel.core.matching;

import com.casesentinel.core.config.PatternsConfig;
import com.casesentinel.core.model.IndicatorKind;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Infers the {@link IndicatorKind} of an indicator string.
 *
 * <p>
 * Rules are evaluated in priority order and the first that applies wins:
 * IPv4 dotted quad, 32/40/64-character hex hash, domain name, e-mail
 * address, executable file name, unknown. Classification is total: every
 * input, including {@code null}, maps to exactly one kind.
 * </p>
 *
 * <p>
 * A name such as {@code payload.exe} is shaped like a domain; the domain rule
 * therefore rejects names ending in a configured executable extension unless
 * that extension is also a common top-level domain ({@code .com}).
 * </p>
 *
 * @since 1.0.0
 */
public class IndicatorClassifier {

    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}$");

    private static final Pattern HASH = Pattern.compile("^(?:[a-f0-9]{32}|[a-f0-9]{40}|[a-f0-9]{64})$");

    private static final Pattern DOMAIN = Pattern.compile(
            "^[a-zA-Z0-9]([a-zA-Z0-9\\-]{0,61}[a-zA-Z0-9])?"
                    + "(\\.[a-zA-Z0-9]([a-zA-Z0-9\\-]{0,61}[a-zA-Z0-9])?)*"
                    + "\\.[a-zA-Z]{2,}$");

    private static final Pattern EMAIL = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    /** Executable extensions that are also real top-level domains. */
    private static final Set<String> EXTENSIONS_THAT_ARE_TLDS = Set.of(".com");

    private final List<String> executableExtensions;

    /**
     * @param executableExtensions extensions such as {@code .exe}; compared
     *                             case-insensitively
     */
    public IndicatorClassifier(List<String> executableExtensions) {
        Objects.requireNonNull(executableExtensions, "Executable extensions must not be null");
        this.executableExtensions = executableExtensions.stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .toList();
    }

    /**
     * @param config validated pattern tables
     * @return a classifier using the configured executable extensions
     */
    public static IndicatorClassifier fromConfig(PatternsConfig config) {
        Objects.requireNonNull(config, "PatternsConfig must not be null");
        return new IndicatorClassifier(config.getExecutableExtensions());
    }

    /**
     * Classify an indicator.
     *
     * @param indicator the raw indicator; surrounding whitespace is ignored
     * @return its kind, never {@code null}
     */
    public IndicatorKind classify(String indicator) {
        if (indicator == null || indicator.isBlank()) {
            return IndicatorKind.UNKNOWN;
        }
        String value = indicator.trim();
        String lower = value.toLowerCase(Locale.ROOT);

        if (IPV4.matcher(value).matches()) {
            return IndicatorKind.IP_ADDRESS;
        }
        if (HASH.matcher(lower).matches()) {
            return IndicatorKind.HASH;
        }
        if (DOMAIN.matcher(value).matches() && !endsWithExecutableOnlyExtension(lower)) {
            return IndicatorKind.DOMAIN;
        }
        if (EMAIL.matcher(value).matches()) {
            return IndicatorKind.EMAIL;
        }
        if (executableExtension(lower) != null) {
            return IndicatorKind.EXECUTABLE;
        }
        return IndicatorKind.UNKNOWN;
    }

    private boolean endsWithExecutableOnlyExtension(String lower) {
        String extension = executableExtension(lower);
        return extension != null && !EXTENSIONS_THAT_ARE_TLDS.contains(extension);
    }

    private String executableExtension(String lower) {
        for (String extension : executableExtensions) {
            if (lower.endsWith(extension)) {
                return extension;
            }
        }
        return null;
    }
}
