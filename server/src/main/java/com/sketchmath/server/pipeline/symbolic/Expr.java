package com.sketchmath.server.pipeline.symbolic;

import java.util.Set;
import java.util.TreeSet;

/**
 * Node of an unevaluated expression tree. Trees keep the structure the user
 * wrote: nothing is folded at construction time.
 */
public abstract class Expr {

    static final int PRECEDENCE_SUM = 1;
    static final int PRECEDENCE_PRODUCT = 2;
    static final int PRECEDENCE_NEGATION = 3;
    static final int PRECEDENCE_POWER = 4;
    static final int PRECEDENCE_ATOM = 5;

    public abstract <T> T accept(ExprVisitor<T> visitor);

    abstract int precedence();

    /** Names of the symbols in this tree, sorted. */
    public Set<String> freeSymbols() {
        Set<String> symbols = new TreeSet<>();
        collectSymbols(symbols);
        return symbols;
    }

    abstract void collectSymbols(Set<String> into);

    @Override
    public String toString() {
        return ExpressionPrinter.print(this);
    }
}
