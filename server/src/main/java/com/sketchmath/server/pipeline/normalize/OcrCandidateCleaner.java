package com.sketchmath.server.pipeline.normalize;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Cleanup for raw handwriting-model output, which is mostly digits and
 * operators misread as letters or punctuation.
 */
public class OcrCandidateCleaner {

    static final CharacterFixTable MODEL_OUTPUT_FIXES = CharacterFixTable.builder()
            .fix("t", "+")
            .fix("l", "1")
            .fix("o", "0")
            .fix("s", "5")
            .build();

    // A minus between digits is often read as one of these; applied one after another.
    private static final Pattern[] PUNCTUATION_BETWEEN_DIGITS = {
            Pattern.compile("(\\d)\\s*\\.\\s*(\\d)"),
            Pattern.compile("(\\d)\\s*,\\s*(\\d)"),
            Pattern.compile("(\\d)\\s*:\\s*(\\d)")
    };

    private static final Pattern ANY_OPERATOR = Pattern.compile("[+\\-*/^=]");
    private static final Pattern INTEGER = Pattern.compile("\\d+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern OUTSIDE_ALPHABET = Pattern.compile("[^0-9a-z+\\-*/^=(). ]");

    public NormalizedExpression clean(String raw) {
        if (raw == null) {
            return NormalizedExpression.EMPTY;
        }
        String text = raw.toLowerCase(Locale.ROOT).trim();
        text = MODEL_OUTPUT_FIXES.apply(text);
        text = TextRepairNormalizer.stripTrailingDots(text);
        for (Pattern punctuation : PUNCTUATION_BETWEEN_DIGITS) {
            text = punctuation.matcher(text).replaceAll("$1-$2");
        }
        text = synthesizePlus(text);
        text = OUTSIDE_ALPHABET.matcher(text).replaceAll("");
        text = WHITESPACE.matcher(text).replaceAll(" ").trim();
        return new NormalizedExpression(text);
    }

    /**
     * Last resort for a read that lost its operator entirely: exactly two
     * whitespace-separated integers become their sum. Anything else is left
     * as is.
     */
    static String synthesizePlus(String text) {
        if (ANY_OPERATOR.matcher(text).find()) {
            return text;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return text;
        }
        String[] tokens = WHITESPACE.split(trimmed);
        if (tokens.length == 2 && INTEGER.matcher(tokens[0]).matches() && INTEGER.matcher(tokens[1]).matches()) {
            return tokens[0] + "+" + tokens[1];
        }
        return text;
    }
}
