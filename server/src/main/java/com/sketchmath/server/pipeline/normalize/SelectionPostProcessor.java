package com.sketchmath.server.pipeline.normalize;

import java.util.regex.Pattern;

/**
 * Final pass over the chosen recognition candidate before it is solved. Only
 * digits, operators, parentheses, dots and the unknown x survive.
 */
public class SelectionPostProcessor {

    static final CharacterFixTable SELECTION_FIXES = CharacterFixTable.builder()
            .fix("l", "1")
            .fix("I", "1")
            .fix("O", "0")
            .fix("o", "0")
            .fix("S", "5")
            .fix("s", "5")
            .fix("G", "6")
            .fix("g", "9")
            .fix("B", "8")
            .fix("Z", "2")
            .fix("z", "2")
            .fix("×", "*")
            .fix("÷", "/")
            .fix("−", "-")
            .fix("[", "(")
            .fix("]", ")")
            .fix("{", "(")
            .fix("}", ")")
            .build();

    static final CharacterFixTable FALLBACK_FIXES = CharacterFixTable.builder()
            .fix("l", "1")
            .fix("O", "0")
            .fix("o", "0")
            .build();

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NOT_ALLOWED = Pattern.compile("[^0-9+\\-*/=().xX ]");
    private static final Pattern ANY_OPERATOR = Pattern.compile("[+\\-*/^=]");

    public String postProcess(String selected) {
        if (selected == null) {
            return "";
        }
        String text = SELECTION_FIXES.apply(selected);
        text = WHITESPACE.matcher(text.trim()).replaceAll(" ");
        text = NOT_ALLOWED.matcher(text).replaceAll("");
        return text.trim();
    }

    /** Cleanup for text from the lower-confidence fallback recognizer. */
    public String postProcessFallback(String raw) {
        if (raw == null) {
            return "";
        }
        return postProcess(FALLBACK_FIXES.apply(raw));
    }

    public boolean hasOperator(String text) {
        return text != null && ANY_OPERATOR.matcher(text).find();
    }
}
