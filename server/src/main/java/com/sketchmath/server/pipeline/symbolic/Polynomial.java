package com.sketchmath.server.pipeline.symbolic;

import com.sketchmath.util.NumberText;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/** Multivariate polynomial with double coefficients; immutable. */
final class Polynomial {

    private static final double CANCELLATION_TOLERANCE = 1e-12;

    static final Polynomial ZERO = new Polynomial(new HashMap<>());
    static final Polynomial ONE = constant(1.0);

    private final Map<Monomial, Double> terms;

    private Polynomial(Map<Monomial, Double> terms) {
        this.terms = terms;
    }

    static Polynomial constant(double value) {
        Map<Monomial, Double> terms = new HashMap<>();
        if (value != 0.0) {
            terms.put(Monomial.ONE, value);
        }
        return new Polynomial(terms);
    }

    static Polynomial symbol(String name) {
        Map<Monomial, Double> terms = new HashMap<>();
        terms.put(Monomial.of(name), 1.0);
        return new Polynomial(terms);
    }

    Polynomial add(Polynomial other) {
        Map<Monomial, Double> sum = new HashMap<>(terms);
        for (Map.Entry<Monomial, Double> term : other.terms.entrySet()) {
            accumulate(sum, term.getKey(), term.getValue());
        }
        return new Polynomial(sum);
    }

    Polynomial subtract(Polynomial other) {
        return add(other.negate());
    }

    Polynomial negate() {
        return scale(-1.0);
    }

    Polynomial scale(double factor) {
        if (factor == 0.0) {
            return ZERO;
        }
        Map<Monomial, Double> scaled = new HashMap<>();
        for (Map.Entry<Monomial, Double> term : terms.entrySet()) {
            scaled.put(term.getKey(), term.getValue() * factor);
        }
        return new Polynomial(scaled);
    }

    Polynomial multiply(Polynomial other) {
        Map<Monomial, Double> product = new HashMap<>();
        for (Map.Entry<Monomial, Double> a : terms.entrySet()) {
            for (Map.Entry<Monomial, Double> b : other.terms.entrySet()) {
                accumulate(product, a.getKey().multiply(b.getKey()), a.getValue() * b.getValue());
            }
        }
        return new Polynomial(product);
    }

    Polynomial pow(int exponent) {
        Polynomial result = ONE;
        for (int i = 0; i < exponent; i++) {
            result = result.multiply(this);
        }
        return result;
    }

    boolean isZero() {
        return terms.isEmpty();
    }

    boolean isConstant() {
        return terms.isEmpty() || (terms.size() == 1 && terms.containsKey(Monomial.ONE));
    }

    double constantValue() {
        return terms.getOrDefault(Monomial.ONE, 0.0);
    }

    Set<String> symbols() {
        Set<String> symbols = new TreeSet<>();
        for (Monomial m : terms.keySet()) {
            symbols.addAll(m.powers().keySet());
        }
        return symbols;
    }

    int degreeIn(String symbol) {
        int degree = 0;
        for (Monomial m : terms.keySet()) {
            degree = Math.max(degree, m.degreeIn(symbol));
        }
        return degree;
    }

    /**
     * Splits this polynomial into coefficients of powers of the symbol; entry k
     * holds the coefficient of symbol^k as a polynomial in the other symbols.
     */
    List<Polynomial> coefficientsIn(String symbol) {
        int degree = degreeIn(symbol);
        List<Map<Monomial, Double>> buckets = new ArrayList<>();
        for (int k = 0; k <= degree; k++) {
            buckets.add(new HashMap<>());
        }
        for (Map.Entry<Monomial, Double> term : terms.entrySet()) {
            Monomial m = term.getKey();
            accumulate(buckets.get(m.degreeIn(symbol)), m.without(symbol), term.getValue());
        }
        List<Polynomial> coefficients = new ArrayList<>();
        for (Map<Monomial, Double> bucket : buckets) {
            coefficients.add(new Polynomial(bucket));
        }
        return coefficients;
    }

    /** Coefficients of a polynomial in at most the given symbol, lowest power first. */
    double[] univariateCoefficients(String symbol) {
        List<Polynomial> parts = coefficientsIn(symbol);
        double[] coefficients = new double[parts.size()];
        for (int k = 0; k < parts.size(); k++) {
            Polynomial part = parts.get(k);
            if (!part.isConstant()) {
                throw new IllegalStateException("Polynomial is not univariate in " + symbol + ": " + this);
            }
            coefficients[k] = part.constantValue();
        }
        return coefficients;
    }

    String render(int significantDigits) {
        if (terms.isEmpty()) {
            return "0";
        }
        TreeMap<Monomial, Double> ordered = new TreeMap<>(terms);
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Monomial, Double> term : ordered.entrySet()) {
            Monomial m = term.getKey();
            double c = term.getValue();
            String magnitude = NumberText.format(Math.abs(c), significantDigits);
            String body;
            if (m.isOne()) {
                body = magnitude;
            } else if ("1".equals(magnitude)) {
                body = m.toString();
            } else {
                body = magnitude + "*" + m;
            }
            if (sb.length() == 0) {
                sb.append(c < 0 ? "-" : "").append(body);
            } else {
                sb.append(c < 0 ? " - " : " + ").append(body);
            }
        }
        return sb.toString();
    }

    // A sum that is rounding noise next to its operands is a cancellation, not a coefficient.
    private static void accumulate(Map<Monomial, Double> into, Monomial m, double c) {
        double existing = into.getOrDefault(m, 0.0);
        double updated = existing + c;
        if (Math.abs(updated) <= CANCELLATION_TOLERANCE * Math.max(Math.abs(existing), Math.abs(c))) {
            into.remove(m);
        } else {
            into.put(m, updated);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Polynomial)) {
            return false;
        }
        return terms.equals(((Polynomial) o).terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    @Override
    public String toString() {
        return render(NumberText.DEFAULT_SIGNIFICANT_DIGITS);
    }
}
