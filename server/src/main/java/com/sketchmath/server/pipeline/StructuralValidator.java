package com.sketchmath.server.pipeline;

import java.util.regex.Pattern;

/**
 * Cheap structural checks run before anything is handed to the parser.
 */
public class StructuralValidator {

    public static final String EMPTY = "Empty expression";
    public static final String NO_NUMBERS_OR_FUNCTIONS = "No numbers or functions found";
    public static final String UNBALANCED_PARENTHESES = "Unbalanced parentheses";
    public static final String CONSECUTIVE_OPERATORS = "Consecutive operators";

    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern FUNCTION_NAME = Pattern.compile("\\b(sin|cos|tan|sqrt|log|ln|exp)\\b",
            Pattern.CASE_INSENSITIVE);
    // A single leading minus is fine; two operator characters in a row are not.
    private static final Pattern OPERATOR_RUN = Pattern.compile("[+\\-*/^]{2,}");

    public ValidationVerdict validate(String expression) {
        if (expression == null || expression.isEmpty()) {
            return ValidationVerdict.rejected(EMPTY);
        }
        boolean hasNumbers = DIGIT.matcher(expression).find();
        boolean hasFunctions = FUNCTION_NAME.matcher(expression).find();
        if (!hasNumbers && !hasFunctions) {
            return ValidationVerdict.rejected(NO_NUMBERS_OR_FUNCTIONS);
        }
        if (count(expression, '(') != count(expression, ')')) {
            return ValidationVerdict.rejected(UNBALANCED_PARENTHESES);
        }
        if (OPERATOR_RUN.matcher(expression).find()) {
            return ValidationVerdict.rejected(CONSECUTIVE_OPERATORS);
        }
        return ValidationVerdict.valid();
    }

    private static int count(String text, char c) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }
}
