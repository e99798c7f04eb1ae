package com.sketchmath.server.pipeline.normalize;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NormalizedExpressionTest {

    @Test
    public void testEmptyConstantIsUsable() {
        assertNotNull(NormalizedExpression.EMPTY);
        assertTrue(NormalizedExpression.EMPTY.isEmpty());
        assertEquals("", NormalizedExpression.EMPTY.getText());
        assertEquals(NormalizedExpression.EMPTY, new NormalizedExpression(""));
    }

    @Test
    public void testRejectsTextOutsideAlphabet() {
        assertThrows(IllegalArgumentException.class, () -> new NormalizedExpression("2#3"));
        assertThrows(IllegalArgumentException.class, () -> new NormalizedExpression(null));
        assertEquals("x^2 - 4 = 0", new NormalizedExpression("x^2 - 4 = 0").getText());
    }
}
