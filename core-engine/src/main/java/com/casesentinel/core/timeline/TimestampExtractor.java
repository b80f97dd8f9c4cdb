package com.casesentinel.core.timeline;

import com.casesentinel.core.config.PatternsConfig;
import com.casesentinel.core.model.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the first recognizable timestamp embedded in free text and renders
 * it as canonical {@code yyyy-MM-dd HH:mm:ss}.
 *
 * <h3>Formats, in priority order</h3>
 * <ol>
 * <li>{@code yyyy-MM-dd HH:mm:ss}</li>
 * <li>{@code MM/dd/yyyy HH:mm:ss}</li>
 * <li>{@code yyyy-MM-ddTHH:mm:ss}</li>
 * <li>{@code dd-MM-yyyy HH:mm:ss}</li>
 * <li>a standalone 13-digit (milliseconds) or 10-digit (seconds) Unix
 * epoch</li>
 * </ol>
 * <p>
 * Dates are resolved strictly: {@code 2024-02-30 10:00:00} matches the first
 * shape but is not a date, so extraction moves on to the next candidate.
 * Epochs are rendered in the configured zone.
 * </p>
 *
 * @since 1.0.0
 */
public class TimestampExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(TimestampExtractor.class);

    /** Canonical output format. */
    public static final DateTimeFormatter CANONICAL = strict("uuuu-MM-dd HH:mm:ss");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final List<TextFormat> TEXT_FORMATS = List.of(
            new TextFormat("\\d{4}-\\d{2}-\\d{2}\\s+\\d{2}:\\d{2}:\\d{2}", "uuuu-MM-dd HH:mm:ss"),
            new TextFormat("\\d{2}/\\d{2}/\\d{4}\\s+\\d{2}:\\d{2}:\\d{2}", "MM/dd/uuuu HH:mm:ss"),
            new TextFormat("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}", "uuuu-MM-dd'T'HH:mm:ss"),
            new TextFormat("\\d{2}-\\d{2}-\\d{4}\\s+\\d{2}:\\d{2}:\\d{2}", "dd-MM-uuuu HH:mm:ss"));

    private static final Pattern EPOCH = Pattern.compile("(?<!\\d)(\\d{13}|\\d{10})(?!\\d)");

    private final List<String> timestampColumns;
    private final ZoneId zone;

    /**
     * @param timestampColumns fallback columns consulted by
     *                         {@link #resolve(String, Row)}, in priority order
     * @param zone             zone epochs are rendered in
     */
    public TimestampExtractor(List<String> timestampColumns, ZoneId zone) {
        this.timestampColumns = List.copyOf(Objects.requireNonNull(timestampColumns,
                "Timestamp columns must not be null"));
        this.zone = Objects.requireNonNull(zone, "ZoneId must not be null");
    }

    /**
     * Extractor over the configured timestamp columns, rendering epochs in
     * UTC.
     */
    public static TimestampExtractor fromConfig(PatternsConfig config) {
        return fromConfig(config, ZoneOffset.UTC);
    }

    public static TimestampExtractor fromConfig(PatternsConfig config, ZoneId zone) {
        Objects.requireNonNull(config, "PatternsConfig must not be null");
        return new TimestampExtractor(config.getTimestampColumns(), zone);
    }

    /**
     * Extract a timestamp from free text.
     *
     * @param text any text; may be {@code null}
     * @return canonical timestamp, or empty when nothing recognizable is
     *         embedded
     */
    public Optional<String> extract(String text) {
        return extractDateTime(text).map(CANONICAL::format);
    }

    /**
     * Like {@link #extract(String)} but returns the parsed value.
     */
    public Optional<LocalDateTime> extractDateTime(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (TextFormat format : TEXT_FORMATS) {
            Matcher m = format.pattern.matcher(text);
            while (m.find()) {
                String candidate = WHITESPACE.matcher(m.group()).replaceAll(" ");
                try {
                    return Optional.of(LocalDateTime.parse(candidate, format.formatter));
                } catch (DateTimeParseException e) {
                    LOG.trace("'{}' looks like a timestamp but does not parse: {}", candidate, e.getMessage());
                }
            }
        }
        Matcher m = EPOCH.matcher(text);
        if (m.find()) {
            String digits = m.group(1);
            long value = Long.parseLong(digits);
            Instant instant = digits.length() == 13 ? Instant.ofEpochMilli(value) : Instant.ofEpochSecond(value);
            return Optional.of(LocalDateTime.ofInstant(instant, zone));
        }
        return Optional.empty();
    }

    /**
     * Resolve the timestamp for a detection: the directly referenced value
     * first, then each fallback column of the row, each tried once.
     *
     * @param directValue the detected cell's text; may be {@code null}
     * @param row         the originating row; may be {@code null}
     * @return canonical timestamp, or empty when unresolved
     */
    public Optional<String> resolve(String directValue, Row row) {
        Optional<String> direct = extract(directValue);
        if (direct.isPresent() || row == null) {
            return direct;
        }
        for (String column : timestampColumns) {
            Optional<String> value = row.text(column).flatMap(this::extract);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    public List<String> getTimestampColumns() {
        return timestampColumns;
    }

    public ZoneId getZone() {
        return zone;
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    private static final class TextFormat {
        private final Pattern pattern;
        private final DateTimeFormatter formatter;

        private TextFormat(String regex, String format) {
            this.pattern = Pattern.compile(regex);
            this.formatter = strict(format);
        }
    }
}
