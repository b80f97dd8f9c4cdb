package com.casesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * A single scalar cell of a forensic record: text, number or nothing.
 *
 * <p>
 * Exports from different tools disagree on column types, so cells are kept
 * as a small closed variant instead of raw objects. Callers that only care
 * about the textual form use {@link #asText()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class CellValue {

    /** The three shapes a cell can take. */
    public enum Kind {
        TEXT,
        NUMBER,
        NULL
    }

    private static final CellValue NULL_VALUE = new CellValue(Kind.NULL, null, null);

    private final Kind kind;
    private final String text;
    private final BigDecimal number;

    private CellValue(Kind kind, String text, BigDecimal number) {
        this.kind = kind;
        this.text = text;
        this.number = number;
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    /**
     * @param text the cell text; {@code null} yields {@link #nullValue()}
     * @return a text cell
     */
    public static CellValue text(String text) {
        return text == null ? NULL_VALUE : new CellValue(Kind.TEXT, text, null);
    }

    /**
     * @param number the numeric value; {@code null} yields {@link #nullValue()}
     * @return a numeric cell
     */
    public static CellValue number(Number number) {
        if (number == null) {
            return NULL_VALUE;
        }
        BigDecimal value = number instanceof BigDecimal bd ? bd : new BigDecimal(number.toString());
        return new CellValue(Kind.NUMBER, null, value);
    }

    /**
     * @return the shared null cell
     */
    public static CellValue nullValue() {
        return NULL_VALUE;
    }

    /**
     * Wrap an arbitrary Java value coming from an ingestion layer.
     *
     * <p>
     * {@link Number}s become numeric cells, {@code null} becomes the null
     * cell, anything else is stored through {@link Object#toString()}.
     * </p>
     *
     * @param raw the raw value
     * @return the matching cell
     */
    public static CellValue of(Object raw) {
        if (raw == null) {
            return NULL_VALUE;
        }
        if (raw instanceof CellValue cell) {
            return cell;
        }
        if (raw instanceof Number n) {
            try {
                return number(n);
            } catch (NumberFormatException e) {
                // NaN and infinities have no decimal form
                return text(n.toString());
            }
        }
        return text(raw.toString());
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public Kind getKind() {
        return kind;
    }

    public boolean isText() {
        return kind == Kind.TEXT;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    /**
     * Textual rendition of the cell. Numbers are written without exponent
     * and without trailing zeros, so an epoch stored as {@code 1.7E9} renders
     * as {@code 1700000000}.
     *
     * @return the text, or empty for the null cell
     */
    public Optional<String> asText() {
        return switch (kind) {
            case TEXT -> Optional.of(text);
            case NUMBER -> Optional.of(renderNumber(number));
            case NULL -> Optional.empty();
        };
    }

    @JsonValue
    Object jsonValue() {
        return switch (kind) {
            case TEXT -> text;
            case NUMBER -> number;
            case NULL -> null;
        };
    }

    private static String renderNumber(BigDecimal value) {
        if (value.signum() == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CellValue that))
            return false;
        if (kind != that.kind)
            return false;
        if (kind == Kind.NUMBER) {
            return number.compareTo(that.number) == 0;
        }
        return Objects.equals(text, that.text);
    }

    @Override
    public int hashCode() {
        return kind == Kind.NUMBER
                ? Objects.hash(kind, renderNumber(number))
                : Objects.hash(kind, text);
    }

    @Override
    public String toString() {
        return asText().orElse("null");
    }
}
