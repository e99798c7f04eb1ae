package com.sketchmath.server.pipeline.normalize;

import com.sketchmath.server.pipeline.symbolic.MathVocabulary;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.regex.Pattern;

/**
 * Cleans a typed or recognized question into the canonical math alphabet.
 */
public class TextRepairNormalizer {

    static final CharacterFixTable FIXES = CharacterFixTable.builder()
            .fix("l", "1")
            .fix("I", "1")
            .fix("O", "0")
            .fix("o", "0")
            .fix("×", "*")
            .fix("÷", "/")
            .fix("−", "-")
            .fix("²", "^2")
            .fix("³", "^3")
            .fix("√", "sqrt")
            .fix("π", "pi")
            .fix("∞", "oo")
            .build();

    // Function and constant names survive the letter fixes ("log" must not become "10g").
    static final Set<String> PROTECTED_WORDS;

    static {
        Set<String> words = new LinkedHashSet<>(MathVocabulary.FUNCTIONS);
        words.addAll(MathVocabulary.CONSTANTS);
        words.remove("e");
        PROTECTED_WORDS = words;
    }

    // "SIN(30)" is read as sin(30); the parser and angle handling only know lowercase names.
    private static final Pattern UPPERCASE_CALL = Pattern.compile("(?<![A-Za-z_])(?i:"
            + MathVocabulary.FUNCTIONS.stream()
                    .sorted(Comparator.comparingInt(String::length).reversed())
                    .collect(Collectors.joining("|"))
            + ")(?=\\s*\\()");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DIGITS_THEN_OPERATOR = Pattern.compile("(\\d+)([+\\-*/^=])");
    private static final Pattern OPERATOR_THEN_DIGITS = Pattern.compile("([+\\-*/^=])(\\d+)");
    private static final Pattern NON_CANONICAL = Pattern.compile("[^0-9a-zA-Z+\\-*/^=(). ]");

    public NormalizedExpression normalize(String raw) {
        if (raw == null) {
            return NormalizedExpression.EMPTY;
        }
        String text = WHITESPACE.matcher(raw.trim()).replaceAll(" ");
        text = stripTrailingDots(text);
        text = UPPERCASE_CALL.matcher(text).replaceAll(m -> m.group().toLowerCase(Locale.ROOT));
        text = FIXES.applyOutside(text, PROTECTED_WORDS);
        text = DIGITS_THEN_OPERATOR.matcher(text).replaceAll("$1 $2");
        text = OPERATOR_THEN_DIGITS.matcher(text).replaceAll("$1 $2");
        text = NON_CANONICAL.matcher(text).replaceAll("");
        text = WHITESPACE.matcher(text).replaceAll(" ").trim();
        return new NormalizedExpression(text);
    }

    static String stripTrailingDots(String text) {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '.') {
            end--;
        }
        return text.substring(0, end);
    }
}
