package com.questrail.stringity.metrics;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FrequencyTableTest
{
    @Test
    void countsPreserveFirstSeenOrder() {
        FrequencyTable<String> table = FrequencyTable.of(List.of("b", "a", "b", "c", "a", "b"));

        assertEquals(List.of("b", "a", "c"), List.copyOf(table.asMap().keySet()));
        assertEquals(3, table.count("b"));
        assertEquals(2, table.count("a"));
        assertEquals(0, table.count("z"));
        assertEquals(3, table.size());
    }

    @Test
    void tiesResolveToFirstSeen() {
        FrequencyTable<String> table = FrequencyTable.of(List.of("x", "y", "y", "x", "z", "w"));

        assertEquals("x", table.mostFrequent().orElseThrow());
        assertEquals("z", table.leastFrequent().orElseThrow());
    }

    @Test
    void emptyTableHasNoRepresentatives() {
        FrequencyTable<String> table = FrequencyTable.of(List.of());

        assertTrue(table.isEmpty());
        assertTrue(table.mostFrequent().isEmpty());
        assertTrue(table.leastFrequent().isEmpty());
    }

    @Test
    void viewIsUnmodifiable() {
        FrequencyTable<String> table = FrequencyTable.of(List.of("a"));
        assertThrows(UnsupportedOperationException.class, () -> table.asMap().put("b", 1));
    }
}
