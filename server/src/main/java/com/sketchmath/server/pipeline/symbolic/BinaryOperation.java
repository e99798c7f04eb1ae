package com.sketchmath.server.pipeline.symbolic;

import java.util.Set;

public final class BinaryOperation extends Expr {

    public enum Operator {
        ADD('+', PRECEDENCE_SUM),
        SUBTRACT('-', PRECEDENCE_SUM),
        MULTIPLY('*', PRECEDENCE_PRODUCT),
        DIVIDE('/', PRECEDENCE_PRODUCT),
        POWER('^', PRECEDENCE_POWER);

        private final char symbol;
        private final int precedence;

        Operator(char symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        public char getSymbol() {
            return symbol;
        }

        int getPrecedence() {
            return precedence;
        }

        static Operator of(char symbol) {
            for (Operator op : values()) {
                if (op.symbol == symbol) {
                    return op;
                }
            }
            throw new IllegalArgumentException("Not an operator: " + symbol);
        }
    }

    private final Operator operator;
    private final Expr left;
    private final Expr right;

    public BinaryOperation(Operator operator, Expr left, Expr right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public Operator getOperator() {
        return operator;
    }

    public Expr getLeft() {
        return left;
    }

    public Expr getRight() {
        return right;
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    int precedence() {
        return operator.getPrecedence();
    }

    @Override
    void collectSymbols(Set<String> into) {
        left.collectSymbols(into);
        right.collectSymbols(into);
    }
}
