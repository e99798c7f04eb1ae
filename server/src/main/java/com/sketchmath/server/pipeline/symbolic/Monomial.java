package com.sketchmath.server.pipeline.symbolic;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/** Product of symbols raised to positive integer powers; immutable. */
final class Monomial implements Comparable<Monomial> {

    static final Monomial ONE = new Monomial(new TreeMap<>());

    private final TreeMap<String, Integer> powers;

    private Monomial(TreeMap<String, Integer> powers) {
        this.powers = powers;
    }

    static Monomial of(String symbol) {
        TreeMap<String, Integer> powers = new TreeMap<>();
        powers.put(symbol, 1);
        return new Monomial(powers);
    }

    Monomial multiply(Monomial other) {
        TreeMap<String, Integer> product = new TreeMap<>(powers);
        for (Map.Entry<String, Integer> entry : other.powers.entrySet()) {
            product.merge(entry.getKey(), entry.getValue(), Integer::sum);
        }
        return new Monomial(product);
    }

    int degreeIn(String symbol) {
        return powers.getOrDefault(symbol, 0);
    }

    int totalDegree() {
        int degree = 0;
        for (int p : powers.values()) {
            degree += p;
        }
        return degree;
    }

    Monomial without(String symbol) {
        if (!powers.containsKey(symbol)) {
            return this;
        }
        TreeMap<String, Integer> reduced = new TreeMap<>(powers);
        reduced.remove(symbol);
        return new Monomial(reduced);
    }

    boolean isOne() {
        return powers.isEmpty();
    }

    Map<String, Integer> powers() {
        return Collections.unmodifiableMap(powers);
    }

    /** Higher total degree first, then by rendered text. */
    @Override
    public int compareTo(Monomial other) {
        int byDegree = Integer.compare(other.totalDegree(), totalDegree());
        return byDegree != 0 ? byDegree : toString().compareTo(other.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Monomial)) {
            return false;
        }
        return powers.equals(((Monomial) o).powers);
    }

    @Override
    public int hashCode() {
        return powers.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Integer> entry : powers.entrySet()) {
            if (sb.length() > 0) {
                sb.append('*');
            }
            sb.append(entry.getKey());
            if (entry.getValue() != 1) {
                sb.append('^').append(entry.getValue());
            }
        }
        return sb.toString();
    }
}
