package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.TestEngines;
import com.spreadsheet.engine.config.EngineProperties;
import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.services.LookupTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FormulaEvaluator: functions, arithmetic, error values and cycles.
 */
class FormulaEvaluatorTest {

    private FormulaEvaluator evaluator;
    private Map<String, Cell> cells;

    @BeforeEach
    void setUp() {
        evaluator = TestEngines.evaluator(new LookupTable(), new EngineProperties());
        cells = TestEngines.cells("A1", "5", "A2", "10");
    }

    private String eval(String formula) {
        return evaluator.evaluate(formula, "Z99", cells);
    }

    @Test
    void testSumOverRange() {
        cells.put("A3", new Cell("=SUM(A1:A2)"));
        assertEquals("15", evaluator.evaluate("=SUM(A1:A2)", "A3", cells));
        assertEquals("22", eval("=SUM(A1:A2, 7)"));
    }

    /**
     * A missing cell reads as 0 and counts towards AVERAGE.
     */
    @Test
    void testAverage() {
        assertEquals("7.5", eval("=AVG(A1:A2)"));
        assertEquals("5", eval("=AVERAGE(A1:A3)"));
    }

    /**
     * COUNT counts values that are nonzero numbers.
     */
    @Test
    void testCount() {
        cells.put("A3", new Cell("abc"));
        cells.put("A4", new Cell("0"));
        assertEquals("2", eval("=COUNT(A1:A5)"));
        assertEquals("2", eval("=COUNT(1, 0, 2)"));
    }

    @Test
    void testMaxMin() {
        assertEquals("10", eval("=MAX(A1:A2, 7)"));
        assertEquals("5", eval("=MIN(A1:A2, 7)"));
        cells.put("B1", new Cell("abc"));
        assertEquals("0", eval("=MAX(B1)"));
    }

    @Test
    void testNestedCallInsideAggregate() {
        assertEquals("15", eval("=SUM(IF(A1>0,A1,0), A2)"));
    }

    @Test
    void testIfWithComparison() {
        cells.put("A1", new Cell("=IF(A2>=10,\"high\",\"low\")"));
        cells.put("A2", new Cell("12"));
        assertEquals("high", evaluator.evaluate("=IF(A2>=10,\"high\",\"low\")", "A1", cells));

        cells.put("A2", new Cell("3"));
        assertEquals("low", evaluator.evaluate("=IF(A2>=10,\"high\",\"low\")", "A1", cells));
    }

    @Test
    void testIfWithText() {
        cells.put("B1", new Cell("yes"));
        cells.put("B2", new Cell("TRUE"));
        assertEquals("ok", eval("=IF(B1=\"yes\",\"ok\",\"no\")"));
        assertEquals("not", eval("=IF(B1>\"abc\",\"gt\",\"not\")"));
        assertEquals("same", eval("=IF(A1<>5,\"diff\",\"same\")"));
        assertEquals("1", eval("=IF(B2,1,2)"));
        assertEquals("2", eval("=IF(0,1,2)"));
        assertEquals("#ERROR!", eval("=IF(A1>0, 1)"));
    }

    @Test
    void testConcatenate() {
        assertEquals("Total: 5 units", eval("=CONCATENATE(\"Total: \", A1, \" units\")"));
        assertEquals("a,b1", eval("=CONCAT(\"a,b\", 1)"));
    }

    @Test
    void testArithmetic() {
        assertEquals("12.5", eval("=A1*2+A2/4"));
        assertEquals("1", eval("=B9+1"));
        assertEquals("2", evaluator.evaluate("1+1", "Z99", cells));
        assertEquals("5", eval("=A1"));
    }

    @Test
    void testTextReadsAsZeroInArithmetic() {
        cells.put("B1", new Cell("hello"));
        assertEquals("hello", eval("=B1"));
        assertEquals("1", eval("=B1+1"));
    }

    @Test
    void testErrorValues() {
        assertEquals("#ERROR!", eval("=FOO(1)"));
        assertEquals("#ERROR!", eval("=1+alert(1)"));
        assertEquals("#ERROR!", eval("=1/0"));
        assertEquals("#ERROR!", eval("=A0+1"));
        assertEquals("#ERROR!", eval("=SUM(A1)+SUM(A2)"));
    }

    @Test
    void testErrorPropagation() {
        cells.put("C1", new Cell("=FOO(1)"));
        assertEquals("#ERROR!", eval("=C1+1"));
        assertEquals("#ERROR!", eval("=SUM(C1, 1)"));
        assertEquals("#ERROR!", eval("=C1"));
    }

    @Test
    void testSelfReference() {
        cells.put("A1", new Cell("=A1+1"));
        assertEquals("#CIRCULAR!", evaluator.evaluate("=A1+1", "A1", cells));
    }

    /**
     * Both members of a cycle, and any cell reading one of them, evaluate to #CIRCULAR!.
     */
    @Test
    void testTwoCellCycle() {
        cells.put("A1", new Cell("=B1+1"));
        cells.put("B1", new Cell("=A1+1"));
        cells.put("C1", new Cell("=A1*2"));

        assertEquals("#CIRCULAR!", evaluator.evaluate("=B1+1", "A1", cells));
        assertEquals("#CIRCULAR!", evaluator.evaluate("=A1+1", "B1", cells));
        assertEquals("#CIRCULAR!", evaluator.evaluate("=A1*2", "C1", cells));
        // repeated evaluation gives the same answer, nothing stays marked in progress
        assertEquals("#CIRCULAR!", evaluator.evaluate("=B1+1", "A1", cells));
        assertEquals("6", eval("=A2-4"));
    }

    @Test
    void testDepthLimit() {
        EngineProperties properties = new EngineProperties();
        properties.setMaxDepth(5);
        FormulaEvaluator shallow = TestEngines.evaluator(new LookupTable(), properties);

        Map<String, Cell> chain = TestEngines.cells("A1", "1");
        for (int row = 2; row <= 10; row++) {
            chain.put("A" + row, new Cell("=A" + (row - 1) + "+1"));
        }
        assertEquals("#ERROR!", shallow.evaluate("=A9+1", "A10", chain));
        assertEquals("4", shallow.evaluate("=A3+1", "A4", chain));
    }

    @Test
    void testRangeLimit() {
        EngineProperties properties = new EngineProperties();
        properties.setMaxRangeCells(5);
        FormulaEvaluator limited = TestEngines.evaluator(new LookupTable(), properties);

        assertEquals("#ERROR!", limited.evaluate("=SUM(A1:A10)", "B1", cells));
        assertEquals("15", limited.evaluate("=SUM(A1:A5)", "B1", cells));
    }

    /**
     * A reference that can never be read fails the whole formula, even in a branch IF does not take.
     */
    @Test
    void testUnusableReferenceInUntakenBranch() {
        assertEquals("#ERROR!", eval("=IF(1,A1,A0)"));
        assertEquals("#ERROR!", eval("=IF(0,SUM(A1:A2),A0)"));
        assertEquals("5", eval("=IF(1,A1,\"A0\")"));
    }

    @Test
    void testMalformedRangeArguments() {
        assertEquals("#ERROR!", eval("=SUM(A1:B)"));
        assertEquals("#ERROR!", eval("=SUM(A1:B2:C3)"));
        assertEquals("#ERROR!", eval("=MAX(1, :A2)"));
        assertEquals("15", eval("=SUM(A2:A1)"));
    }

    @Test
    void testDeepParenthesesBecomeError() {
        String deep = "=" + "(".repeat(200000) + "1" + ")".repeat(200000);
        assertEquals("#ERROR!", eval(deep));
        assertEquals("1", eval("=" + "(".repeat(50) + "1" + ")".repeat(50)));
    }

    @Test
    void testDeepCallNestingBecomesError() {
        assertEquals("#ERROR!", eval("=" + "SUM(".repeat(3000) + "1" + ")".repeat(3000)));
        assertEquals("1", eval("=" + "SUM(".repeat(50) + "1" + ")".repeat(50)));
    }

    /**
     * Nesting is counted across the cells one evaluation passes through.
     */
    @Test
    void testNestingLimitSpansCells() {
        EngineProperties properties = new EngineProperties();
        properties.setMaxNesting(20);
        FormulaEvaluator limited = TestEngines.evaluator(new LookupTable(), properties);

        Map<String, Cell> chain = TestEngines.cells("A1", "=" + "SUM(".repeat(8) + "1" + ")".repeat(8));
        chain.put("A2", new Cell("=" + "SUM(".repeat(8) + "A1" + ")".repeat(8)));
        chain.put("A3", new Cell("=" + "SUM(".repeat(8) + "A2" + ")".repeat(8)));

        assertEquals("1", limited.evaluate(chain.get("A2").getFormula(), "A2", chain));
        assertEquals("#ERROR!", limited.evaluate(chain.get("A3").getFormula(), "A3", chain));
    }
}
