package com.sketchmath.server.pipeline;

import java.util.List;

/**
 * Picks the most math-like candidate: one point per operator, equals sign or
 * parenthesis, plus one per character of length. The earliest candidate wins ties.
 */
public class CandidateSelector {

    private static final String MATH_SYMBOLS = "+-*/=()";

    public static int score(String candidate) {
        int symbols = 0;
        for (int i = 0; i < candidate.length(); i++) {
            if (MATH_SYMBOLS.indexOf(candidate.charAt(i)) >= 0) {
                symbols++;
            }
        }
        return symbols + candidate.length();
    }

    /**
     * @return index of the chosen candidate, or -1 for an empty list
     */
    public int selectIndex(List<String> candidates) {
        int bestIdx = -1;
        int bestScore = Integer.MIN_VALUE;
        for (int i = 0; i < candidates.size(); i++) {
            int s = score(candidates.get(i));
            if (s > bestScore) {
                bestScore = s;
                bestIdx = i;
            }
        }
        return bestIdx;
    }
}
