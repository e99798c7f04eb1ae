package com.sketchmath.server.pipeline.symbolic;

/**
 * Raised when an equation falls outside what the solver can isolate, such as
 * an unknown inside a trigonometric call.
 */
public class UnsolvableEquationException extends RuntimeException {

    public UnsolvableEquationException(String message) {
        super(message);
    }
}
