package com.sketchmath.server.pipeline.symbolic;

/** Quotient of two polynomials, kept unreduced. */
final class RationalFunction {

    private final Polynomial numerator;
    private final Polynomial denominator;

    RationalFunction(Polynomial numerator, Polynomial denominator) {
        if (denominator.isZero()) {
            throw new ArithmeticException("division by zero");
        }
        this.numerator = numerator;
        this.denominator = denominator;
    }

    static RationalFunction of(Polynomial polynomial) {
        return new RationalFunction(polynomial, Polynomial.ONE);
    }

    static RationalFunction constant(double value) {
        return of(Polynomial.constant(value));
    }

    Polynomial numerator() {
        return numerator;
    }

    Polynomial denominator() {
        return denominator;
    }

    RationalFunction add(RationalFunction other) {
        if (denominator.equals(other.denominator)) {
            return new RationalFunction(numerator.add(other.numerator), denominator);
        }
        return new RationalFunction(
                numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
                denominator.multiply(other.denominator));
    }

    RationalFunction subtract(RationalFunction other) {
        return add(other.negate());
    }

    RationalFunction negate() {
        return new RationalFunction(numerator.negate(), denominator);
    }

    RationalFunction multiply(RationalFunction other) {
        return new RationalFunction(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    RationalFunction divide(RationalFunction other) {
        if (other.numerator.isZero()) {
            throw new ArithmeticException("division by zero");
        }
        return new RationalFunction(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
    }

    RationalFunction pow(int exponent) {
        if (exponent >= 0) {
            return new RationalFunction(numerator.pow(exponent), denominator.pow(exponent));
        }
        if (numerator.isZero()) {
            throw new ArithmeticException("division by zero");
        }
        return new RationalFunction(denominator.pow(-exponent), numerator.pow(-exponent));
    }

    boolean isConstant() {
        return numerator.isConstant() && denominator.isConstant();
    }

    double constantValue() {
        return numerator.constantValue() / denominator.constantValue();
    }
}
