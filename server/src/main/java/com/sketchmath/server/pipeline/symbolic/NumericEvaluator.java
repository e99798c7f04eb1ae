package com.sketchmath.server.pipeline.symbolic;

import net.objecthunter.exp4j.Expression;
import net.objecthunter.exp4j.ExpressionBuilder;
import net.objecthunter.exp4j.function.Function;

import java.math.BigDecimal;

/**
 * Evaluates closed trees (no free symbols) to a double through exp4j. The tree
 * is rendered fully parenthesized so exp4j's own precedence rules never matter.
 * Division by zero surfaces as the {@link ArithmeticException} exp4j throws.
 */
public class NumericEvaluator {

    private static final String INFINITY_VARIABLE = "oo";
    private static final String NAN_VARIABLE = "nan";

    private static final Function LN = new Function("ln", 1) {
        @Override
        public double apply(double... args) {
            return Math.log(args[0]);
        }
    };

    public double evaluate(Expr expr) {
        if (!expr.freeSymbols().isEmpty()) {
            throw new IllegalArgumentException("Cannot evaluate numerically, free symbols remain: "
                    + expr.freeSymbols());
        }
        String rendered = expr.accept(new Exp4jRenderer());
        Expression expression = new ExpressionBuilder(rendered)
                .function(LN)
                .variables(INFINITY_VARIABLE, NAN_VARIABLE)
                .build()
                .setVariable(INFINITY_VARIABLE, Double.POSITIVE_INFINITY)
                .setVariable(NAN_VARIABLE, Double.NaN);
        return expression.evaluate();
    }

    private static final class Exp4jRenderer implements ExprVisitor<String> {

        @Override
        public String visitNumber(NumberLiteral number) {
            return BigDecimal.valueOf(number.getValue()).toPlainString();
        }

        @Override
        public String visitSymbol(Symbol symbol) {
            throw new IllegalStateException("Unbound symbol " + symbol.getName());
        }

        @Override
        public String visitConstant(Constant constant) {
            switch (constant.getKind()) {
                case PI:
                    return "pi";
                case E:
                    return "e";
                case INFINITY:
                    return INFINITY_VARIABLE;
                default:
                    return NAN_VARIABLE;
            }
        }

        @Override
        public String visitNegation(Negation negation) {
            return "(-(" + negation.getOperand().accept(this) + "))";
        }

        @Override
        public String visitBinary(BinaryOperation operation) {
            return "((" + operation.getLeft().accept(this) + ")"
                    + operation.getOperator().getSymbol()
                    + "(" + operation.getRight().accept(this) + "))";
        }

        @Override
        public String visitFunction(FunctionCall call) {
            return call.getName() + "(" + call.getArgument().accept(this) + ")";
        }
    }
}
