package com.sketchmath.server.pipeline.symbolic;

/**
 * Folds a tree into a rational function of its symbols. Closed sub-trees the
 * polynomial algebra cannot express (function calls, fractional powers) are
 * evaluated numerically; the same constructs applied to unknowns make the
 * equation unsolvable.
 */
final class RationalFunctionConverter implements ExprVisitor<RationalFunction> {

    private static final int MAX_EXPANDED_POWER = 64;

    private final NumericEvaluator evaluator;

    RationalFunctionConverter(NumericEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    RationalFunction convert(Expr expr) {
        return expr.accept(this);
    }

    @Override
    public RationalFunction visitNumber(NumberLiteral number) {
        return RationalFunction.constant(number.getValue());
    }

    @Override
    public RationalFunction visitSymbol(Symbol symbol) {
        return RationalFunction.of(Polynomial.symbol(symbol.getName()));
    }

    @Override
    public RationalFunction visitConstant(Constant constant) {
        double value = constant.getKind().getValue();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new UnsolvableEquationException("cannot solve an equation containing " + constant.getName());
        }
        return RationalFunction.constant(value);
    }

    @Override
    public RationalFunction visitNegation(Negation negation) {
        return negation.getOperand().accept(this).negate();
    }

    @Override
    public RationalFunction visitBinary(BinaryOperation operation) {
        RationalFunction left = operation.getLeft().accept(this);
        switch (operation.getOperator()) {
            case ADD:
                return left.add(operation.getRight().accept(this));
            case SUBTRACT:
                return left.subtract(operation.getRight().accept(this));
            case MULTIPLY:
                return left.multiply(operation.getRight().accept(this));
            case DIVIDE:
                return left.divide(operation.getRight().accept(this));
            default:
                return power(operation, left);
        }
    }

    private RationalFunction power(BinaryOperation operation, RationalFunction base) {
        Expr exponentTree = operation.getRight();
        if (!exponentTree.freeSymbols().isEmpty()) {
            throw new UnsolvableEquationException("cannot solve for an unknown in an exponent: "
                    + ExpressionPrinter.print(operation));
        }
        double exponent = evaluator.evaluate(exponentTree);
        boolean integral = exponent == Math.rint(exponent) && Math.abs(exponent) <= MAX_EXPANDED_POWER;
        if (integral) {
            return base.pow((int) exponent);
        }
        if (base.isConstant()) {
            return RationalFunction.constant(Math.pow(base.constantValue(), exponent));
        }
        throw new UnsolvableEquationException("cannot solve with a non-integer power of an unknown: "
                + ExpressionPrinter.print(operation));
    }

    @Override
    public RationalFunction visitFunction(FunctionCall call) {
        if (!call.freeSymbols().isEmpty()) {
            throw new UnsolvableEquationException("cannot isolate an unknown inside "
                    + ExpressionPrinter.print(call));
        }
        return RationalFunction.constant(evaluator.evaluate(call));
    }
}
