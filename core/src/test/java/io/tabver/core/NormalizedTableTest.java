// file: src/test/java/io/tabver/core/NormalizedTableTest.java
package io.tabver.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NormalizedTableTest {

    @Test
    void duplicate_location_is_rejected() {
        var b = NormalizedTable.builder().put("S", 1, 1, CellValue.number(1));
        assertThrows(IllegalArgumentException.class, () -> b.put("S", 1, 1, CellValue.number(2)));
    }

    @Test
    void row_level_location_is_not_a_cell() {
        var b = NormalizedTable.builder();
        assertThrows(IllegalArgumentException.class, () -> b.put(CellKey.rowOf("S", 0), CellValue.empty()));
    }

    @Test
    void invalid_locations_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> CellKey.of(" ", 0, 0));
        assertThrows(IllegalArgumentException.class, () -> CellKey.of("S", -1, 0));
        assertThrows(IllegalArgumentException.class, () -> CellKey.of("S", 0, -2));
    }

    @Test
    void sheet_cells_do_not_leak_into_similarly_named_sheets() {
        var t = NormalizedTable.builder()
                .put("S", 0, 0, CellValue.text("a"))
                .put("S2", 0, 0, CellValue.text("b"))
                .put("S", 4, 1, CellValue.text("c"))
                .build();

        assertEquals(2, t.sheetCells("S").size());
        assertEquals(1, t.sheetCells("S2").size());
        assertTrue(t.sheetCells("missing").isEmpty());
    }

    @Test
    void rows_view_groups_by_row_then_column() {
        var t = NormalizedTable.builder()
                .put("S", 2, 1, CellValue.text("c"))
                .put("S", 0, 0, CellValue.text("a"))
                .put("S", 2, 0, CellValue.text("b"))
                .build();

        var rows = t.rows("S");
        assertEquals(2, rows.size());
        assertFalse(rows.containsKey(1));
        assertEquals(CellValue.text("b"), rows.get(2).firstEntry().getValue());
        assertEquals(CellValue.text("c"), rows.get(2).lastEntry().getValue());
    }

    @Test
    void overlay_builder_does_not_touch_the_original() {
        var original = NormalizedTable.builder()
                .put("S", 0, 0, CellValue.number(1))
                .put("S", 0, 1, CellValue.number(2))
                .build();

        var overlaid = original.toBuilder()
                .set(CellKey.of("S", 0, 0), CellValue.number(9))
                .remove(CellKey.of("S", 0, 1))
                .build();

        assertEquals(2, original.size());
        assertEquals(CellValue.number(1), original.get(CellKey.of("S", 0, 0)));
        assertEquals(1, overlaid.size());
        assertEquals(CellValue.number(9), overlaid.get(CellKey.of("S", 0, 0)));
        assertTrue(overlaid.sheets().contains("S"), "sheet survives even when cells are removed");
    }

    @Test
    void a1_references() {
        assertEquals("S!A1", CellKey.of("S", 0, 0).a1());
        assertEquals("S!Z3", CellKey.of("S", 2, 25).a1());
        assertEquals("S!AA1", CellKey.of("S", 0, 26).a1());
        assertEquals("S!AB10", CellKey.of("S", 9, 27).a1());
        assertEquals("S!4:4", CellKey.rowOf("S", 3).a1());
    }

    @Test
    void typed_values_are_not_interchangeable() {
        assertNotEquals(CellValue.number(10).value(), CellValue.text("10").value());
        assertEquals(new Value.Numeric(-0.0), new Value.Numeric(0.0));
        assertEquals(new Value.Numeric(Double.NaN), new Value.Numeric(Double.NaN));
        assertEquals("10", CellValue.number(10).rawText());
        assertEquals("2.5", CellValue.number(2.5).rawText());
        assertEquals("=SUM(A1:A2)", CellValue.formula("SUM(A1:A2)", new Value.Numeric(3)).rawText());
        assertEquals("SUM(A1:A2)", CellValue.formula("SUM(A1:A2)", new Value.Numeric(3)).formula().orElseThrow());
    }
}
