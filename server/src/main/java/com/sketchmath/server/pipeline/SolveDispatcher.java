package com.sketchmath.server.pipeline;

import com.sketchmath.server.pipeline.symbolic.EvaluatedValue;
import com.sketchmath.server.pipeline.symbolic.Equation;
import com.sketchmath.server.pipeline.symbolic.Expr;
import com.sketchmath.server.pipeline.symbolic.ExpressionParseException;
import com.sketchmath.server.pipeline.symbolic.Solution;
import com.sketchmath.server.pipeline.symbolic.SymbolicEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Sends validated text to the symbolic engine: equations (anything with '=')
 * are solved, everything else is evaluated. Always returns a result, never
 * throws.
 */
public class SolveDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(SolveDispatcher.class);

    private final SymbolicEngine engine;

    public SolveDispatcher(SymbolicEngine engine) {
        this.engine = engine;
    }

    public SolveResult dispatch(String text) {
        try {
            int equals = text.indexOf('=');
            if (equals >= 0) {
                return solveEquation(text.substring(0, equals).trim(), text.substring(equals + 1).trim());
            }
            return evaluateExpression(text);
        } catch (ExpressionParseException e) {
            logger.error("Parsing failed: {}", e.getMessage());
            return SolveResult.failure(SolveErrorKind.PARSE, e.getMessage());
        } catch (RuntimeException e) {
            String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            logger.error("Unexpected error while solving '{}': {}", text, detail);
            return SolveResult.failure(SolveErrorKind.SOLVE, detail);
        } catch (StackOverflowError e) {
            // Nesting is bounded by the parser; a very long flat chain can still exhaust the stack.
            logger.error("Expression too large to solve ({} characters)", text.length());
            return SolveResult.failure(SolveErrorKind.SOLVE, "expression too large");
        }
    }

    private SolveResult solveEquation(String left, String right) {
        logger.info("Parsing equation: {} = {}", left, right);
        Equation equation = new Equation(engine.parse(left), engine.parse(right));
        List<Solution> solutions = engine.solve(equation);

        StringBuilder steps = new StringBuilder("Equation: ").append(engine.render(equation, false));
        if (equation.freeSymbols().isEmpty()) {
            steps.append("\nCheck: ").append(engine.render(equation, true))
                    .append(holds(equation) ? " is true" : " is false");
        }
        steps.append("\nSolution: ").append(Solution.render(solutions));

        logger.info("Successfully solved: {}", Solution.render(solutions));
        return SolveResult.equation(solutions, steps.toString());
    }

    private SolveResult evaluateExpression(String text) {
        logger.info("Parsing expression: {}", text);
        Expr expr = engine.parse(text);
        EvaluatedValue value = engine.evaluate(expr);
        String steps = "Expression: " + engine.render(expr) + "\nValue: " + value;
        logger.info("Successfully solved: {}", value);
        return SolveResult.expression(value, steps);
    }

    private boolean holds(Equation equation) {
        double left = engine.evaluate(equation.getLeft()).getNumber();
        double right = engine.evaluate(equation.getRight()).getNumber();
        if (left == right) {
            return true;
        }
        double scale = Math.max(1.0, Math.max(Math.abs(left), Math.abs(right)));
        return Math.abs(left - right) <= 1e-9 * scale;
    }
}
