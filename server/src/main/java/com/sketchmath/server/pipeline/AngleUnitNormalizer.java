package com.sketchmath.server.pipeline;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites trig calls written in degrees, fn(X), into fn((X)*pi/180).
 *
 * <p>One left-to-right pass: after a call is rewritten, scanning resumes
 * behind it, so a trig call nested in the argument of another one is left in
 * degrees ("sin(cos(30))" only converts the outer call).
 */
public class AngleUnitNormalizer {

    // A letter before the name rules out "asin" matching as "sin"; a digit does not ("2sin(30)").
    private static final Pattern TRIG_CALL = Pattern.compile("(?<![A-Za-z_])(sin|cos|tan|asin|acos|atan)\\(");

    public String toRadians(String expression) {
        if (expression == null || expression.isEmpty()) {
            return expression;
        }
        StringBuilder sb = new StringBuilder();
        Matcher m = TRIG_CALL.matcher(expression);
        int from = 0;
        while (from < expression.length() && m.find(from)) {
            int open = m.end() - 1;
            int close = matchingParen(expression, open);
            if (close < 0) {
                break;
            }
            String argument = expression.substring(open + 1, close);
            sb.append(expression, from, m.start())
                    .append(m.group(1))
                    .append("((")
                    .append(argument)
                    .append(")*pi/180)");
            from = close + 1;
        }
        sb.append(expression.substring(from));
        return sb.toString();
    }

    private static int matchingParen(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
