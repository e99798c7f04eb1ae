package com.sketchmath.server.pipeline.normalize;

import java.util.regex.Pattern;

/** Text restricted to the canonical math alphabet. */
public final class NormalizedExpression {

    private static final Pattern CANONICAL = Pattern.compile("[0-9a-zA-Z+\\-*/^=(). ]*");

    // Declared after CANONICAL: the constructor validates against it.
    public static final NormalizedExpression EMPTY = new NormalizedExpression("");

    private final String text;

    public NormalizedExpression(String text) {
        if (text == null || !CANONICAL.matcher(text).matches()) {
            throw new IllegalArgumentException("Text outside the canonical alphabet: " + text);
        }
        this.text = text;
    }

    public String getText() {
        return text;
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NormalizedExpression)) {
            return false;
        }
        return text.equals(((NormalizedExpression) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
