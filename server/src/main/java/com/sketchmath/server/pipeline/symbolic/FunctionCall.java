package com.sketchmath.server.pipeline.symbolic;

import java.util.Set;

public final class FunctionCall extends Expr {

    private final String name;
    private final Expr argument;

    public FunctionCall(String name, Expr argument) {
        if (!MathVocabulary.FUNCTIONS.contains(name)) {
            throw new IllegalArgumentException("Unsupported function: " + name);
        }
        this.name = name;
        this.argument = argument;
    }

    public String getName() {
        return name;
    }

    public Expr getArgument() {
        return argument;
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    int precedence() {
        return PRECEDENCE_ATOM;
    }

    @Override
    void collectSymbols(Set<String> into) {
        argument.collectSymbols(into);
    }
}
