package com.spreadsheet.calc.models;

import com.spreadsheet.calc.exceptions.InvalidCellAddressException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellAddressTest {

    @Test
    void testParse() {
        CellAddress b3 = CellAddress.parse("B3");
        assertEquals(2, b3.getRow());
        assertEquals(1, b3.getCol());
        assertEquals(b3, CellAddress.parse("$b$3"));
        assertEquals(new CellAddress(0, 26), CellAddress.parse("AA1"));
    }

    @Test
    void testToA1() {
        assertEquals("A1", new CellAddress(0, 0).toA1());
        assertEquals("Z10", new CellAddress(9, 25).toA1());
        assertEquals("XFD1048576", new CellAddress(CellAddress.MAX_ROWS - 1, CellAddress.MAX_COLUMNS - 1).toA1());
    }

    @Test
    void testColumnConversions() {
        assertEquals(0, CellAddress.columnIndex("A"));
        assertEquals(701, CellAddress.columnIndex("ZZ"));
        assertEquals("AAA", CellAddress.columnLetters(702));
    }

    @Test
    void testInvalidAddresses() {
        assertThrows(InvalidCellAddressException.class, () -> CellAddress.parse("A0"));
        assertThrows(InvalidCellAddressException.class, () -> CellAddress.parse("1A"));
        assertThrows(InvalidCellAddressException.class, () -> CellAddress.parse("A"));
        assertThrows(InvalidCellAddressException.class, () -> CellAddress.parse("XFE1"));
        assertThrows(InvalidCellAddressException.class, () -> CellAddress.parse("A1048577"));
        assertThrows(InvalidCellAddressException.class, () -> new CellAddress(-1, 0));
    }

    @Test
    void testOrderingIsRowMajor() {
        assertTrue(CellAddress.parse("B1").compareTo(CellAddress.parse("A2")) < 0);
        assertTrue(CellAddress.parse("A2").compareTo(CellAddress.parse("B2")) < 0);
    }

    @Test
    void testRangeNormalisesCorners() {
        CellRange range = CellRange.parse("C3:A1");
        assertEquals("A1:C3", range.toString());
        assertEquals(3, range.rowCount());
        assertTrue(range.contains(1, 1));
        assertFalse(range.contains(3, 0));
        assertTrue(range.intersects(CellRange.parse("C3:D4")));
        assertFalse(range.intersects(CellRange.parse("D1:D9")));
    }
}
