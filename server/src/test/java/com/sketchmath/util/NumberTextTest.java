package com.sketchmath.util;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class NumberTextTest {

    @Test
    public void testIntegralValuesLoseFraction() {
        assertEquals("4", NumberText.format(4.0));
        assertEquals("-12", NumberText.format(-12.0));
        assertEquals("0", NumberText.format(-0.0));
    }

    @Test
    public void testRoundsToSignificantDigits() {
        assertEquals("0.3", NumberText.format(0.1 + 0.2));
        assertEquals("0.333333333333", NumberText.format(1.0 / 3));
        assertEquals("0.333", NumberText.format(1.0 / 3, 3));
        assertEquals("0.5", NumberText.format(Math.sin(Math.PI / 6)));
    }

    @Test
    public void testNonFiniteSpelling() {
        assertEquals("nan", NumberText.format(Double.NaN));
        assertEquals("oo", NumberText.format(Double.POSITIVE_INFINITY));
        assertEquals("-oo", NumberText.format(Double.NEGATIVE_INFINITY));
    }

    @Test
    public void testComplexRendering() {
        assertEquals("1 + 2*I", NumberText.formatComplex(1.0, 2.0, 12));
        assertEquals("-0.5 - I", NumberText.formatComplex(-0.5, -1.0, 12));
        assertEquals("-I", NumberText.formatComplex(0.0, -1.0, 12));
        assertEquals("3*I", NumberText.formatComplex(0.0, 3.0, 12));
        // Imaginary noise from iteration is dropped
        assertEquals("2", NumberText.formatComplex(2.0, 1e-15, 12));
    }

    @Test
    public void testPlain() {
        assertEquals("3", NumberText.plain(3.0));
        assertEquals("-3", NumberText.plain(-3.0));
        assertEquals("2.5", NumberText.plain(2.5));
        assertEquals("0.1", NumberText.plain(0.1));
        assertThrows(NumberFormatException.class, () -> NumberText.plain(Double.NaN));
    }

    @Test
    public void testParse() {
        assertEquals(4.5, NumberText.parse("4.5"), 1e-12);
        assertEquals(7.0, NumberText.parse(" 7 "), 1e-12);
        assertEquals(3.0, NumberText.parse(3), 1e-12);
        assertThrows(NumberFormatException.class, () -> NumberText.parse("abc"));
        assertThrows(NumberFormatException.class, () -> NumberText.parse(null));
        assertThrows(NumberFormatException.class, () -> NumberText.parse("Infinity"));
        assertThrows(NumberFormatException.class, () -> NumberText.parse(Boolean.TRUE));
    }
}
