package com.sketchmath.server.pipeline;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class CandidateSelectorTest {

    private final CandidateSelector selector = new CandidateSelector();

    @Test
    public void testScore() {
        assertEquals(5, CandidateSelector.score("12+3"));
        assertEquals(8, CandidateSelector.score("(1+2)"));
        assertEquals(0, CandidateSelector.score(""));
    }

    @Test
    public void testPicksMostMathLike() {
        assertEquals(0, selector.selectIndex(Arrays.asList("12+3", "x=5")));
        assertEquals(1, selector.selectIndex(Arrays.asList("123", "1+2")));
    }

    @Test
    public void testTiesGoToEarliest() {
        assertEquals(0, selector.selectIndex(Arrays.asList("1+2", "3+4")));
    }

    @Test
    public void testEmptySetSelectsNothing() {
        assertEquals(-1, selector.selectIndex(Collections.emptyList()));
    }
}
