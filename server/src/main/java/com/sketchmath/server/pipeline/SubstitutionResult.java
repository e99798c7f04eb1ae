package com.sketchmath.server.pipeline;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class SubstitutionResult {
    private final String text;
    private final Set<String> freeVariables;
    private final Map<String, Double> substitutions;
    private final List<String> warnings;

    public SubstitutionResult(String text, Set<String> freeVariables, Map<String, Double> substitutions,
            List<String> warnings) {
        this.text = text;
        this.freeVariables = Collections.unmodifiableSet(freeVariables);
        this.substitutions = Collections.unmodifiableMap(substitutions);
        this.warnings = Collections.unmodifiableList(warnings);
    }

    public String getText() {
        return text;
    }

    /** Variables found in the expression before substitution. */
    public Set<String> getFreeVariables() {
        return freeVariables;
    }

    public Map<String, Double> getSubstitutions() {
        return substitutions;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
