package com.sketchmath.server.pipeline;

import com.sketchmath.server.pipeline.symbolic.DefaultSymbolicEngine;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class MathPipelineTest {

    private static MathPipeline pipeline(PipelineConfig config) {
        return new MathPipeline(config, new DefaultSymbolicEngine(config));
    }

    private final MathPipeline degrees = pipeline(PipelineConfig.defaults());

    @Test
    public void testTypedQuestion() {
        SolveResult result = degrees.solveQuestion("What is 2+2?");
        assertTrue(result.isSuccess());
        assertEquals("4", result.getResultText());
        assertTrue(result.getSteps().contains("2 + 2"));
        assertTrue(result.getSteps().contains("4"));
    }

    @Test
    public void testLinearEquation() {
        assertEquals("[5]", degrees.solveQuestion("x+5=10").getResultText());
        assertEquals("[5]", degrees.solveQuestion("Solve x+5=10").getResultText());
    }

    @Test
    public void testQuadraticEquation() {
        assertEquals("[2, 3]", degrees.solveQuestion("x²-5x+6=0").getResultText());
        assertEquals("[-2, 2]", degrees.solveQuestion("x^2 - 4 = 0").getResultText());
    }

    @Test
    public void testLabelsAreSubstituted() {
        SolveResult result = degrees.solveQuestion("a+b=10",
                Arrays.asList(Label.of("a", 3), Label.assignment("b=4")));
        assertTrue(result.isSuccess());
        assertTrue(result.getSteps().contains("3+4=10"));
        assertTrue(result.getSteps().contains("is false"));
        assertEquals("[]", result.getResultText());
    }

    @Test
    public void testMalformedLabelDoesNotStopTheSolve() {
        SolveResult result = degrees.solveQuestion("x+a=10",
                Arrays.asList(Label.of("a", "oops"), Label.of("a", 4)));
        assertEquals("[6]", result.getResultText());
    }

    @Test
    public void testDegreesByDefault() {
        assertEquals("0.5", degrees.solveQuestion("sin(30)").getResultText());
        assertEquals("0.5", degrees.solveQuestion("cos(60)").getResultText());
    }

    @Test
    public void testRadiansConfigLeavesTrigAlone() {
        MathPipeline radians = pipeline(new PipelineConfig(PipelineConfig.RADIANS, 12, 500, 1e-12));
        assertEquals("1", radians.solveQuestion("cos(0)").getResultText());
        assertNotEquals("0.5", radians.solveQuestion("sin(30)").getResultText());
    }

    @Test
    public void testEmptyInput() {
        SolveResult result = degrees.solveQuestion("", Collections.emptyList());
        assertEquals(SolveErrorKind.EMPTY_INPUT, result.getErrorKind());
        assertEquals("No question provided", result.getError());
        assertEquals(SolveErrorKind.EMPTY_INPUT, degrees.solveQuestion(null).getErrorKind());
    }

    @Test
    public void testValidationFailures() {
        SolveResult noNumbers = degrees.solveQuestion("x+y");
        assertEquals(SolveErrorKind.VALIDATION, noNumbers.getErrorKind());
        assertEquals("Invalid expression: No numbers or functions found", noNumbers.getError());

        assertEquals("Invalid expression: Unbalanced parentheses", degrees.solveQuestion("(2+3").getError());
        assertEquals("Invalid expression: Empty expression", degrees.solveQuestion("What is ?").getError());
    }

    @Test
    public void testDivisionByZeroIsReported() {
        SolveResult result = degrees.solveQuestion("1/0");
        assertEquals(SolveErrorKind.SOLVE, result.getErrorKind());
        assertNull(result.getResultText());
    }

    @Test
    public void testTrigCallWithCoefficient() {
        SolveResult result = degrees.solveQuestion("2sin(30)");
        assertTrue(result.isSuccess(), result.getError());
        assertEquals("1", result.getResultText());
    }

    @Test
    public void testUppercaseFunctionName() {
        assertEquals("0.5", degrees.solveQuestion("SIN(30)").getResultText());
    }

    @Test
    public void testDeeplyNestedInputIsAParseError() {
        String nested = "(".repeat(20000) + "1" + ")".repeat(20000);
        SolveResult result = degrees.solveQuestion(nested);
        assertEquals(SolveErrorKind.PARSE, result.getErrorKind());
        assertTrue(result.getError().contains("nested"));
    }
}
