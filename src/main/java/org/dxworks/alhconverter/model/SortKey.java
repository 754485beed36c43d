package org.dxworks.alhconverter.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Ordering hint for the children of a node on export.
 *
 * <p>Keys are totally ordered: numeric keys sort before non-numeric ones, numeric keys
 * ascend by value and non-numeric keys ascend by ordinal string comparison.
 */
public final class SortKey implements Comparable<SortKey> {

    private final BigDecimal number;
    private final String text;

    private SortKey(BigDecimal number, String text) {
        this.number = number;
        this.text = text;
    }

    public static SortKey of(long value) {
        return new SortKey(BigDecimal.valueOf(value), null);
    }

    /**
     * @throws IllegalArgumentException for NaN and infinite values, which have no place in the order
     */
    public static SortKey of(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Sort key must be a finite number, got " + value);
        }
        return new SortKey(BigDecimal.valueOf(value), null);
    }

    /**
     * Parses the key as a number where possible and keeps it as text otherwise.
     */
    public static SortKey of(String value) {
        Objects.requireNonNull(value, "value");
        try {
            return new SortKey(new BigDecimal(value.trim()), null);
        } catch (NumberFormatException e) {
            return new SortKey(null, value);
        }
    }

    public boolean isNumeric() {
        return number != null;
    }

    @Override
    public int compareTo(SortKey other) {
        if (isNumeric() && other.isNumeric()) {
            return number.compareTo(other.number);
        }
        if (isNumeric()) return -1;
        if (other.isNumeric()) return 1;
        return text.compareTo(other.text);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SortKey other)) return false;
        return compareTo(other) == 0;
    }

    @Override
    public int hashCode() {
        return isNumeric() ? number.stripTrailingZeros().hashCode() : text.hashCode();
    }

    @Override
    public String toString() {
        return isNumeric() ? number.stripTrailingZeros().toPlainString() : text;
    }
}
