package com.sketchmath.server.pipeline;

/** Every way a request can end without an answer. None of them are fatal. */
public enum SolveErrorKind {
    EMPTY_INPUT(""),
    NO_OPERATOR(""),
    VALIDATION("Invalid expression: "),
    PARSE("Parse error: "),
    SOLVE("Unexpected error: ");

    private final String prefix;

    SolveErrorKind(String prefix) {
        this.prefix = prefix;
    }

    public String describe(String detail) {
        return prefix + detail;
    }
}
