package com.sketchmath.server.pipeline;

import com.sketchmath.server.pipeline.symbolic.EvaluatedValue;
import com.sketchmath.server.pipeline.symbolic.Solution;

import java.util.Collections;
import java.util.List;

public final class SolveResult {

    public enum Kind {
        EQUATION, EXPRESSION
    }

    private final Kind kind;
    private final List<Solution> solutions;
    private final EvaluatedValue value;
    private final String steps;
    private final SolveErrorKind errorKind;
    private final String error;

    private SolveResult(Kind kind, List<Solution> solutions, EvaluatedValue value, String steps,
            SolveErrorKind errorKind, String error) {
        this.kind = kind;
        this.solutions = solutions;
        this.value = value;
        this.steps = steps;
        this.errorKind = errorKind;
        this.error = error;
    }

    public static SolveResult equation(List<Solution> solutions, String steps) {
        return new SolveResult(Kind.EQUATION, Collections.unmodifiableList(solutions), null, steps, null, null);
    }

    public static SolveResult expression(EvaluatedValue value, String steps) {
        return new SolveResult(Kind.EXPRESSION, Collections.emptyList(), value, steps, null, null);
    }

    public static SolveResult failure(SolveErrorKind errorKind, String detail) {
        return new SolveResult(null, Collections.emptyList(), null, null, errorKind, errorKind.describe(detail));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** EQUATION or EXPRESSION; null for failures. */
    public Kind getKind() {
        return kind;
    }

    public List<Solution> getSolutions() {
        return solutions;
    }

    public EvaluatedValue getValue() {
        return value;
    }

    /** The answer as the caller sees it: "[5]", "4", or null after a failure. */
    public String getResultText() {
        if (kind == Kind.EQUATION) {
            return Solution.render(solutions);
        }
        if (kind == Kind.EXPRESSION) {
            return value.toString();
        }
        return null;
    }

    public String getSteps() {
        return steps;
    }

    public SolveErrorKind getErrorKind() {
        return errorKind;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "SolveResult{" + kind + " " + getResultText() + "}" : "SolveResult{" + error + "}";
    }
}
