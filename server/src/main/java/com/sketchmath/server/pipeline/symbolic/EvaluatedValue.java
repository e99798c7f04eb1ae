package com.sketchmath.server.pipeline.symbolic;

/**
 * Outcome of evaluating an expression: a number when the tree was closed, or
 * the printed tree when free symbols remained.
 */
public final class EvaluatedValue {

    private final Double number;
    private final String text;

    private EvaluatedValue(Double number, String text) {
        this.number = number;
        this.text = text;
    }

    public static EvaluatedValue numeric(double number, String text) {
        return new EvaluatedValue(number, text);
    }

    public static EvaluatedValue symbolic(String text) {
        return new EvaluatedValue(null, text);
    }

    public boolean isNumeric() {
        return number != null;
    }

    /** @throws IllegalStateException for symbolic values */
    public double getNumber() {
        if (number == null) {
            throw new IllegalStateException("Symbolic value has no number: " + text);
        }
        return number;
    }

    @Override
    public String toString() {
        return text;
    }
}
