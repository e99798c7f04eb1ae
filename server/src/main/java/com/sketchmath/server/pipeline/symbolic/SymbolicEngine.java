package com.sketchmath.server.pipeline.symbolic;

import java.util.List;

/**
 * The solver the dispatcher talks to. Implementations must be safe to share
 * between concurrent requests.
 */
public interface SymbolicEngine {

    /**
     * Parses text into an unevaluated tree.
     *
     * @throws ExpressionParseException if the text does not follow the grammar
     */
    Expr parse(String text);

    /** Complete solution set for the free symbols of the equation. */
    List<Solution> solve(Equation equation);

    /** Numeric value of a closed tree, or its printed form when symbols remain. */
    EvaluatedValue evaluate(Expr expr);

    String render(Expr expr);

    String render(Equation equation, boolean compact);
}
