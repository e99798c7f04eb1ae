package com.sketchmath.server.pipeline;

import com.sketchmath.server.pipeline.symbolic.DefaultSymbolicEngine;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SolveDispatcherTest {

    private final SolveDispatcher dispatcher = new SolveDispatcher(new DefaultSymbolicEngine());

    @Test
    public void testEquation() {
        SolveResult result = dispatcher.dispatch("x+ 5 = 10");
        assertTrue(result.isSuccess());
        assertEquals(SolveResult.Kind.EQUATION, result.getKind());
        assertEquals("[5]", result.getResultText());
        assertEquals("Equation: x + 5 = 10\nSolution: [5]", result.getSteps());
    }

    @Test
    public void testEquationWithoutUnknownsIsChecked() {
        SolveResult wrong = dispatcher.dispatch("3+4 = 10");
        assertEquals("[]", wrong.getResultText());
        assertEquals("Equation: 3 + 4 = 10\nCheck: 3+4=10 is false\nSolution: []", wrong.getSteps());

        SolveResult right = dispatcher.dispatch("0.1+0.2 = 0.3");
        assertTrue(right.getSteps().contains("Check: 0.1+0.2=0.3 is true"));
    }

    @Test
    public void testSplitsOnFirstEquals() {
        SolveResult result = dispatcher.dispatch("x = 1 = 2");
        assertFalse(result.isSuccess());
        assertEquals(SolveErrorKind.PARSE, result.getErrorKind());
    }

    @Test
    public void testExpression() {
        SolveResult result = dispatcher.dispatch("2 + 2");
        assertEquals(SolveResult.Kind.EXPRESSION, result.getKind());
        assertEquals("4", result.getResultText());
        assertEquals("Expression: 2 + 2\nValue: 4", result.getSteps());
        assertNull(result.getError());
    }

    @Test
    public void testExpressionWithFreeSymbols() {
        SolveResult result = dispatcher.dispatch("2x + 1");
        assertEquals("2*x + 1", result.getResultText());
        assertFalse(result.getValue().isNumeric());
    }

    @Test
    public void testParseError() {
        SolveResult result = dispatcher.dispatch("2 +");
        assertFalse(result.isSuccess());
        assertEquals(SolveErrorKind.PARSE, result.getErrorKind());
        assertTrue(result.getError().startsWith("Parse error: "));
        assertNull(result.getResultText());
        assertNull(result.getSteps());
    }

    @Test
    public void testSolveErrors() {
        SolveResult division = dispatcher.dispatch("1/0");
        assertEquals(SolveErrorKind.SOLVE, division.getErrorKind());
        assertTrue(division.getError().startsWith("Unexpected error: "));

        SolveResult transcendental = dispatcher.dispatch("sin(x) = 1");
        assertEquals(SolveErrorKind.SOLVE, transcendental.getErrorKind());
        assertEquals("Unexpected error: cannot isolate an unknown inside sin(x)", transcendental.getError());
    }

    @Test
    public void testDeepNestingIsAParseError() {
        String nested = "(".repeat(20000) + "1" + ")".repeat(20000);
        SolveResult result = dispatcher.dispatch(nested);
        assertEquals(SolveErrorKind.PARSE, result.getErrorKind());
        assertTrue(result.getError().startsWith("Parse error: "));
    }
}
