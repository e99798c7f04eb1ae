package com.sketchmath.server.pipeline.symbolic;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Fixed identifier tables shared by the parser, the variable extractor and the
 * text normalizers.
 */
public final class MathVocabulary {

    public static final Set<String> FUNCTIONS = ordered(
            "sin", "cos", "tan", "asin", "acos", "atan", "sqrt", "log", "ln", "exp", "abs");

    public static final Set<String> TRIG_FUNCTIONS = ordered("sin", "cos", "tan", "asin", "acos", "atan");

    public static final Set<String> CONSTANTS = ordered("pi", "e", "oo", "inf", "nan");

    /** Identifiers that are never free variables. */
    public static final Set<String> EXCLUDED_IDENTIFIERS;

    static {
        Set<String> excluded = new LinkedHashSet<>(FUNCTIONS);
        excluded.addAll(CONSTANTS);
        EXCLUDED_IDENTIFIERS = Collections.unmodifiableSet(excluded);
    }

    private MathVocabulary() {
    }

    private static Set<String> ordered(String... names) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(names)));
    }
}
