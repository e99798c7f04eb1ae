package com.sketchmath.server.pipeline.symbolic;

import java.util.Set;

public final class Symbol extends Expr {

    private final String name;

    public Symbol(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitSymbol(this);
    }

    @Override
    int precedence() {
        return PRECEDENCE_ATOM;
    }

    @Override
    void collectSymbols(Set<String> into) {
        into.add(name);
    }
}
