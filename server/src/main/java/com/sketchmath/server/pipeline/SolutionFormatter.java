package com.sketchmath.server.pipeline;

/** Plain-text rendering of a result for display. */
public class SolutionFormatter {

    public String format(SolveResult result) {
        if (result == null || !result.isSuccess()) {
            return "Could not solve the problem.";
        }
        String steps = "\n\nSteps:\n" + result.getSteps();
        if (result.getKind() == SolveResult.Kind.EQUATION) {
            if (result.getSolutions().size() == 1) {
                return "Solution: " + result.getSolutions().get(0) + steps;
            }
            return "Solutions: " + result.getResultText() + steps;
        }
        return "Result: " + result.getResultText() + steps;
    }
}
