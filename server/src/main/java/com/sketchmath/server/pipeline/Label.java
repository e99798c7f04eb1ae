package com.sketchmath.server.pipeline;

/**
 * A measured or user-entered quantity tied to a symbol on the diagram, either
 * {text: "a", value: 3} or {text: "a=3"}. The value arrives as whatever the
 * client sent: a number, a string, or nothing.
 */
public class Label {
    public String text;
    public Object value;

    public Label() {
    }

    public Label(String text, Object value) {
        this.text = text;
        this.value = value;
    }

    public static Label of(String text, Object value) {
        return new Label(text, value);
    }

    public static Label assignment(String text) {
        return new Label(text, null);
    }

    @Override
    public String toString() {
        return value == null ? "Label{" + text + "}" : "Label{" + text + " -> " + value + "}";
    }
}
