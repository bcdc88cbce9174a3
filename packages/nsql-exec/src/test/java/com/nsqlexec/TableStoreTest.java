package com.nsqlexec;

import com.nsqlexec.table.FuzzyMatcher;
import com.nsqlexec.table.TableStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TableStoreTest {

    private TableStore table;

    @BeforeEach
    void setUp() {
        table = TableStore.of("1992 Summer Olympics", List.of("Nation", "Gold", "No."), List.of(
                List.of("Spain", "13", "1"),
                List.of("France", "8", "2")));
    }

    @Test
    void testBlankAndRepeatedHeadersAreMadeUnique() {
        TableStore t = TableStore.of("t", Arrays.asList("Name", "", "name", "Name"), List.of());
        assertEquals(List.of("Name", "col_1", "name_2", "Name_3"), t.getColumns());
    }

    @Test
    void testShortRowsArePaddedAndLongRowsTruncated() {
        TableStore t = TableStore.of("t", List.of("a", "b"), List.of(List.of("1"), List.of("1", "2", "3")));
        assertEquals(Arrays.asList("1", null), t.getRows().get(0));
        assertEquals(List.of("1", "2"), t.getRows().get(1));
    }

    @Test
    void testResolveColumn() {
        assertEquals(0, table.resolveColumn("Nation"));
        assertEquals(1, table.resolveColumn("GOLD"));
        assertEquals(2, table.resolveColumn("no"));
        assertEquals(-1, table.resolveColumn("Silver"));
        assertEquals(-1, table.indexOf("gold"));
    }

    @Test
    void testTableReferences() {
        assertTrue(table.isReferencedBy("w"));
        assertTrue(table.isReferencedBy("1992 Summer Olympics"));
        assertTrue(table.isReferencedBy("1992_summer_olympics"));
        assertFalse(table.isReferencedBy("medals"));
        assertFalse(table.isReferencedBy(null));
    }

    @Test
    void testProjectKeepsRequestedOrderAndSkipsUnknownColumns() {
        TableStore projected = table.project(List.of("gold", "Silver", "Nation"));
        assertEquals(List.of("Gold", "Nation"), projected.getColumns());
        assertEquals(List.of("13", "Spain"), projected.getRows().get(0));
        assertEquals(table.getTitle(), projected.getTitle());
    }

    @Test
    void testFuzzyMatching() {
        assertEquals("hometeam", FuzzyMatcher.canonical("Home Team"));
        assertEquals("+/-", FuzzyMatcher.canonical("+/-"));
        assertEquals("Nation", FuzzyMatcher.closest("nations", table.getColumns(), 0.6));
        assertNull(FuzzyMatcher.closest("population", table.getColumns(), 0.6));
        assertEquals(1.0, FuzzyMatcher.similarity("Home Team", "home_team"), 1e-9);
    }
}
