package com.sketchmath.server.pipeline.symbolic;

import com.sketchmath.server.pipeline.PipelineConfig;
import com.sketchmath.util.NumberText;

import java.util.List;

public class DefaultSymbolicEngine implements SymbolicEngine {

    private final NumericEvaluator evaluator = new NumericEvaluator();
    private final EquationSolver solver;
    private final int significantDigits;

    public DefaultSymbolicEngine(PipelineConfig config) {
        this.significantDigits = config.significantDigits;
        this.solver = new EquationSolver(evaluator, config.maxRootIterations, config.rootTolerance,
                config.significantDigits);
    }

    public DefaultSymbolicEngine() {
        this(PipelineConfig.defaults());
    }

    @Override
    public Expr parse(String text) {
        return ExpressionParser.parse(text);
    }

    @Override
    public List<Solution> solve(Equation equation) {
        return solver.solve(equation);
    }

    @Override
    public EvaluatedValue evaluate(Expr expr) {
        if (!expr.freeSymbols().isEmpty()) {
            return EvaluatedValue.symbolic(render(expr));
        }
        double value = evaluator.evaluate(expr);
        return EvaluatedValue.numeric(value, NumberText.format(value, significantDigits));
    }

    @Override
    public String render(Expr expr) {
        return ExpressionPrinter.print(expr);
    }

    @Override
    public String render(Equation equation, boolean compact) {
        return ExpressionPrinter.print(equation, compact);
    }
}
