package com.spreadsheet.engine.models;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValueTypeTest {

    @Test
    void testDetect() {
        assertEquals(ValueType.FORMULA, ValueType.detect("=A1+1"));
        assertEquals(ValueType.NUMBER, ValueType.detect("42"));
        assertEquals(ValueType.NUMBER, ValueType.detect("-3.5"));
        assertEquals(ValueType.BOOLEAN, ValueType.detect("TRUE"));
        assertEquals(ValueType.DATE, ValueType.detect("2024-01-15"));
        assertEquals(ValueType.DATE, ValueType.detect("1/15/2024"));
        assertEquals(ValueType.TEXT, ValueType.detect("hello"));
        assertEquals(ValueType.TEXT, ValueType.detect(""));
    }

    @Test
    void testJsonNames() {
        assertEquals("formula", ValueType.FORMULA.toValue());
        assertEquals(ValueType.NUMBER, ValueType.fromValue("Number"));
    }

    /**
     * A cell keeps its formula only while its raw value is one.
     */
    @Test
    void testCellFollowsRawValue() {
        Cell cell = new Cell("=A1*2");
        assertTrue(cell.hasFormula());
        assertEquals("=A1*2", cell.getFormula());

        cell.setRawValue("12");
        assertFalse(cell.hasFormula());
        assertNull(cell.getFormula());
        assertEquals("12", cell.getDisplayValue());
    }

    @Test
    void testCellErrorResult() {
        Cell cell = new Cell("=B1");
        cell.applyResult("#CIRCULAR!");
        assertEquals("#CIRCULAR!", cell.getError());
        assertNull(cell.getValue());
        assertEquals("#CIRCULAR!", cell.getDisplayValue());

        cell.applyResult("3");
        assertNull(cell.getError());
        assertEquals("3", cell.getDisplayValue());
    }
}
