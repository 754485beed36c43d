package org.dxworks.alhconverter.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SortKeyTest {

    @Test
    void numericKeysSortBeforeTextKeys() {
        List<SortKey> keys = new ArrayList<>(List.of(
                SortKey.of("beta"), SortKey.of(10), SortKey.of("Alpha"), SortKey.of(2.5), SortKey.of("3")));
        Collections.sort(keys);

        List<String> sorted = new ArrayList<>();
        keys.forEach(key -> sorted.add(key.toString()));
        assertEquals(List.of("2.5", "3", "10", "Alpha", "beta"), sorted);
    }

    @Test
    void nonFiniteNumbersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> SortKey.of(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> SortKey.of(Double.POSITIVE_INFINITY));
        assertFalse(SortKey.of("NaN").isNumeric());
    }

    @Test
    void numericTextIsParsedAsNumber() {
        assertTrue(SortKey.of(" 42 ").isNumeric());
        assertFalse(SortKey.of("4x").isNumeric());
        assertEquals(SortKey.of(42), SortKey.of("42.0"));
        assertEquals(SortKey.of(42).hashCode(), SortKey.of("42.0").hashCode());
    }

    @Test
    void textKeysCompareOrdinally() {
        assertTrue(SortKey.of("Z").compareTo(SortKey.of("a")) < 0);
        assertEquals(0, SortKey.of("a").compareTo(SortKey.of("a")));
    }
}
