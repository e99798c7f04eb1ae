package com.sketchmath.server.pipeline.symbolic;

import java.util.Set;

public final class NumberLiteral extends Expr {

    private final String literal;
    private final double value;

    public NumberLiteral(String literal) {
        this.literal = literal;
        this.value = Double.parseDouble(literal);
    }

    public String getLiteral() {
        return literal;
    }

    public double getValue() {
        return value;
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitNumber(this);
    }

    @Override
    int precedence() {
        return PRECEDENCE_ATOM;
    }

    @Override
    void collectSymbols(Set<String> into) {
    }
}
