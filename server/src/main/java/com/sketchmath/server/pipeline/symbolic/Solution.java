package com.sketchmath.server.pipeline.symbolic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One entry of a solution set: a bare value when the equation had a single
 * unknown, or an assignment {x: value} when it was solved for one of several.
 */
public final class Solution {

    private final String symbol;
    private final String value;

    private Solution(String symbol, String value) {
        this.symbol = symbol;
        this.value = value;
    }

    public static Solution value(String value) {
        return new Solution(null, value);
    }

    public static Solution assignment(String symbol, String value) {
        return new Solution(symbol, value);
    }

    /** The unknown this value belongs to, or null for a bare value. */
    public String getSymbol() {
        return symbol;
    }

    public String getValue() {
        return value;
    }

    public static String render(List<Solution> solutions) {
        return solutions.stream().map(Solution::toString).collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public String toString() {
        return symbol == null ? value : "{" + symbol + ": " + value + "}";
    }
}
