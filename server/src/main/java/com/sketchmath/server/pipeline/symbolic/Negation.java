package com.sketchmath.server.pipeline.symbolic;

import java.util.Set;

public final class Negation extends Expr {

    private final Expr operand;

    public Negation(Expr operand) {
        this.operand = operand;
    }

    public Expr getOperand() {
        return operand;
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitNegation(this);
    }

    @Override
    int precedence() {
        return PRECEDENCE_NEGATION;
    }

    @Override
    void collectSymbols(Set<String> into) {
        operand.collectSymbols(into);
    }
}
