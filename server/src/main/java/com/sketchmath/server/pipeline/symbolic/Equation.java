package com.sketchmath.server.pipeline.symbolic;

import java.util.Set;
import java.util.TreeSet;

/** An unevaluated equality between two expression trees. */
public final class Equation {

    private final Expr left;
    private final Expr right;

    public Equation(Expr left, Expr right) {
        this.left = left;
        this.right = right;
    }

    public Expr getLeft() {
        return left;
    }

    public Expr getRight() {
        return right;
    }

    public Set<String> freeSymbols() {
        Set<String> symbols = new TreeSet<>(left.freeSymbols());
        symbols.addAll(right.freeSymbols());
        return symbols;
    }

    @Override
    public String toString() {
        return ExpressionPrinter.print(this, false);
    }
}
