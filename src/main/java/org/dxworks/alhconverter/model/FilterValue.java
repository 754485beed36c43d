package org.dxworks.alhconverter.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Value a filter expression is compared against. {@link #TRUE} marks an expression that is
 * itself boolean and is used without any comparison in Phoebus.
 */
public final class FilterValue {

    public static final FilterValue TRUE = new FilterValue(null);

    private final BigDecimal number;

    private FilterValue(BigDecimal number) {
        this.number = number;
    }

    public static FilterValue of(long value) {
        return new FilterValue(BigDecimal.valueOf(value));
    }

    public static FilterValue of(BigDecimal value) {
        return new FilterValue(Objects.requireNonNull(value, "value"));
    }

    /**
     * @throws NumberFormatException if the text is not a number
     */
    public static FilterValue parse(String text) {
        return new FilterValue(new BigDecimal(text.trim()));
    }

    public boolean isBooleanShortcut() {
        return number == null;
    }

    /** The value as written in a FORCEPV line. The boolean marker is written as 1. */
    public String legacyText() {
        return number == null ? "1" : plain(number);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterValue other)) return false;
        if (number == null || other.number == null) return number == other.number;
        return number.compareTo(other.number) == 0;
    }

    @Override
    public int hashCode() {
        return number == null ? 0 : number.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return number == null ? "true" : plain(number);
    }

    private static String plain(BigDecimal value) {
        return value.signum() == 0 ? "0" : value.stripTrailingZeros().toPlainString();
    }
}
