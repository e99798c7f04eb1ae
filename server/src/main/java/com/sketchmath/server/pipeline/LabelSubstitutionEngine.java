package com.sketchmath.server.pipeline;

import com.sketchmath.server.pipeline.symbolic.MathVocabulary;
import com.sketchmath.util.NumberText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Binds diagram labels to the free variables of an expression and writes their
 * values into the text.
 */
public class LabelSubstitutionEngine {

    private static final Logger logger = LoggerFactory.getLogger(LabelSubstitutionEngine.class);

    private static final Pattern IDENTIFIER = Pattern.compile("\\b[a-zA-Z_][a-zA-Z0-9_]*\\b");

    /** Identifiers of the expression minus function names and constants, in order of appearance. */
    public Set<String> extractVariables(String expression) {
        Set<String> variables = new LinkedHashSet<>();
        if (expression == null || expression.isEmpty()) {
            return variables;
        }
        Matcher m = IDENTIFIER.matcher(expression);
        while (m.find()) {
            if (!MathVocabulary.EXCLUDED_IDENTIFIERS.contains(m.group())) {
                variables.add(m.group());
            }
        }
        return variables;
    }

    public SubstitutionResult substitute(String expression, List<Label> labels) {
        String text = expression == null ? "" : expression;
        Set<String> variables = extractVariables(text);
        Map<String, Double> substitutions = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();

        if (text.isEmpty() || labels == null || labels.isEmpty()) {
            return new SubstitutionResult(text, variables, substitutions, warnings);
        }
        logger.info("Variables found in expression: {}", variables);

        for (Label label : labels) {
            if (label == null || label.text == null) {
                continue;
            }
            if (label.value != null) {
                String name = label.text.trim();
                if (!variables.contains(name)) {
                    continue;
                }
                try {
                    substitutions.put(name, NumberText.parse(label.value));
                    logger.info("Substituting {} = {}", name, label.value);
                } catch (NumberFormatException e) {
                    warn(warnings, "Invalid value for " + name + ": " + label.value);
                }
            } else if (label.text.contains("=")) {
                int split = label.text.indexOf('=');
                String name = label.text.substring(0, split).trim();
                String rawValue = label.text.substring(split + 1).trim();
                if (!variables.contains(name)) {
                    continue;
                }
                try {
                    substitutions.put(name, NumberText.parse(rawValue));
                    logger.info("Substituting {} = {}", name, rawValue);
                } catch (NumberFormatException e) {
                    warn(warnings, "Invalid label format: " + label.text);
                }
            }
        }

        for (Map.Entry<String, Double> entry : substitutions.entrySet()) {
            Pattern token = Pattern.compile("\\b" + Pattern.quote(entry.getKey()) + "\\b");
            text = token.matcher(text).replaceAll(Matcher.quoteReplacement(literal(entry.getValue())));
        }
        return new SubstitutionResult(text, variables, substitutions, warnings);
    }

    // Negative values are parenthesized so "2*a" with a=-3 reads "2*(-3)", not "2*-3".
    private static String literal(double value) {
        String plain = NumberText.plain(value);
        return value < 0 ? "(" + plain + ")" : plain;
    }

    private static void warn(List<String> warnings, String message) {
        logger.warn(message);
        warnings.add(message);
    }
}
