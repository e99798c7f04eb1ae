package com.sketchmath.server.pipeline;

import java.util.regex.Pattern;

/** Strips question scaffolding ("What is ...?") from typed input. */
public class QuestionPreprocessor {

    private static final Pattern[] LEADING_PHRASES = {
            Pattern.compile("^\\s*what\\s+is\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^\\s*calculate\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^\\s*solve\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^\\s*find\\s+", Pattern.CASE_INSENSITIVE)
    };
    private static final Pattern TRAILING_EQUALS_QUESTION = Pattern.compile("=\\s*\\?$");
    private static final Pattern TRAILING_QUESTION = Pattern.compile("\\?$");

    public String preprocess(String question) {
        if (question == null || question.isEmpty()) {
            return "";
        }
        String text = question;
        for (Pattern phrase : LEADING_PHRASES) {
            text = phrase.matcher(text).replaceFirst("");
        }
        text = TRAILING_EQUALS_QUESTION.matcher(text).replaceFirst("");
        text = TRAILING_QUESTION.matcher(text).replaceFirst("");
        return text.trim();
    }
}
