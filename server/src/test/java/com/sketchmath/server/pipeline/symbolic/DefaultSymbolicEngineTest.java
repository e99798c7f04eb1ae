package com.sketchmath.server.pipeline.symbolic;

import com.sketchmath.server.pipeline.PipelineConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DefaultSymbolicEngineTest {

    private final DefaultSymbolicEngine engine = new DefaultSymbolicEngine();

    private String solve(String left, String right) {
        List<Solution> solutions = engine.solve(new Equation(engine.parse(left), engine.parse(right)));
        return Solution.render(solutions);
    }

    private String evaluate(String text) {
        return engine.evaluate(engine.parse(text)).toString();
    }

    @Test
    public void testEvaluateClosedExpressions() {
        assertEquals("4", evaluate("2 + 2"));
        assertEquals("3.5", evaluate("7/2"));
        assertEquals("0.333333333333", evaluate("1/3"));
        assertEquals("4", evaluate("sqrt(16)"));
        assertEquals("1", evaluate("ln(e)"));
        assertEquals("8", evaluate("2^3"));
        assertEquals("-6", evaluate("-2*3"));
        assertTrue(engine.evaluate(engine.parse("2 + 2")).isNumeric());
    }

    @Test
    public void testEvaluateWithFreeSymbolsPrintsExpression() {
        EvaluatedValue value = engine.evaluate(engine.parse("x+ 1"));
        assertFalse(value.isNumeric());
        assertEquals("x + 1", value.toString());
        assertThrows(IllegalStateException.class, value::getNumber);
    }

    @Test
    public void testDivisionByZero() {
        assertThrows(ArithmeticException.class, () -> evaluate("1/0"));
    }

    @Test
    public void testLinear() {
        assertEquals("[5]", solve("x + 5", "10"));
        assertEquals("[0.5]", solve("2*x", "1"));
        assertEquals("[-4]", solve("3*(x + 2)", "x - 2"));
    }

    @Test
    public void testQuadratic() {
        assertEquals("[2, 3]", solve("x^2 - 5x + 6", "0"));
        assertEquals("[-2, 2]", solve("x^2 - 4", "0"));
        assertEquals("[0]", solve("x^2", "0"));
        assertEquals("[-I, I]", solve("x^2 + 1", "0"));
    }

    @Test
    public void testCubic() {
        assertEquals("[1, 2, 3]", solve("x^3 - 6*x^2 + 11*x - 6", "0"));
    }

    @Test
    public void testRationalExcludesPoles() {
        assertEquals("[-1]", solve("(x^2 - 1)/(x - 1)", "0"));
        assertEquals("[0.5]", solve("1/x", "2"));
    }

    @Test
    public void testSeveralUnknownsSolvedForFirst() {
        assertEquals("[{x: -y + 10}]", solve("x + y", "10"));
        // x is not linear, so y is used
        assertEquals("[{y: x^2}]", solve("x^2", "y"));
    }

    @Test
    public void testNoUnknowns() {
        assertEquals("[]", solve("3 + 4", "7"));
        assertEquals("[]", solve("3 + 4", "10"));
        assertEquals("[]", solve("2*x", "x + x"));
    }

    @Test
    public void testTranscendentalIsUnsolvable() {
        assertThrows(UnsolvableEquationException.class, () -> solve("sin(x)", "1"));
        assertThrows(UnsolvableEquationException.class, () -> solve("2^x", "8"));
    }

    @Test
    public void testClosedFunctionCallsFoldIntoCoefficients() {
        assertEquals("[2]", solve("x + sqrt(4)", "4"));
    }

    @Test
    public void testSignificantDigitsFromConfig() {
        DefaultSymbolicEngine coarse = new DefaultSymbolicEngine(new PipelineConfig("degrees", 4, 500, 1e-12));
        assertEquals("0.3333", coarse.evaluate(coarse.parse("1/3")).toString());
    }

    @Test
    public void testRenderEquation() {
        Equation equation = new Equation(engine.parse("3+4"), engine.parse("10"));
        assertEquals("3 + 4 = 10", engine.render(equation, false));
        assertEquals("3+4=10", engine.render(equation, true));
    }

    @Test
    public void testLargeConstantsKeepTheUnknown() {
        assertEquals("[1000000000000]", solve("x", "1000000000000"));
        assertEquals("[-2000000, 2000000]", solve("x^2", "4000000000000"));
    }

    @Test
    public void testRoundingNoiseCancels() {
        assertEquals("[]", solve("0.1*3*x", "0.3*x + 1"));
    }
}
