package com.sketchmath.server.pipeline.symbolic;

import java.util.Set;

public final class Constant extends Expr {

    public enum Kind {
        PI(Math.PI),
        E(Math.E),
        INFINITY(Double.POSITIVE_INFINITY),
        NAN(Double.NaN);

        private final double value;

        Kind(double value) {
            this.value = value;
        }

        public double getValue() {
            return value;
        }
    }

    private final String name;
    private final Kind kind;

    public Constant(String name) {
        this.name = name;
        this.kind = kindOf(name);
    }

    static Kind kindOf(String name) {
        switch (name) {
            case "pi":
                return Kind.PI;
            case "e":
                return Kind.E;
            case "oo":
            case "inf":
                return Kind.INFINITY;
            case "nan":
                return Kind.NAN;
            default:
                throw new IllegalArgumentException("Unknown constant: " + name);
        }
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    int precedence() {
        return PRECEDENCE_ATOM;
    }

    @Override
    void collectSymbols(Set<String> into) {
    }
}
