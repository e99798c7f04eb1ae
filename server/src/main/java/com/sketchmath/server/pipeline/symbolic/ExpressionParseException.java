package com.sketchmath.server.pipeline.symbolic;

/**
 * Raised when text does not follow the expression grammar.
 */
public class ExpressionParseException extends RuntimeException {

    private final String text;
    private final int position;

    public ExpressionParseException(String detail, String text, int position) {
        super(detail + " at position " + position + " in '" + text + "'");
        this.text = text;
        this.position = position;
    }

    public String getText() {
        return text;
    }

    public int getPosition() {
        return position;
    }
}
