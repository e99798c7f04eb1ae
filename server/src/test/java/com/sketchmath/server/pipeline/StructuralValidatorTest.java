package com.sketchmath.server.pipeline;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class StructuralValidatorTest {

    private final StructuralValidator validator = new StructuralValidator();

    private String reason(String expression) {
        return validator.validate(expression).getReason();
    }

    @Test
    public void testRejections() {
        assertEquals("Empty expression", reason(""));
        assertEquals("Empty expression", reason(null));
        assertEquals("No numbers or functions found", reason("x+y"));
        assertEquals("Unbalanced parentheses", reason("(2+3"));
        assertEquals("Consecutive operators", reason("2++3"));
        assertEquals("Consecutive operators", reason("2*-3"));
        assertFalse(validator.validate("2++3").isOk());
    }

    @Test
    public void testChecksRunInOrder() {
        // Both unbalanced and a run of operators: parentheses are reported first
        assertEquals("Unbalanced parentheses", reason("(2++3"));
    }

    @Test
    public void testAccepted() {
        ValidationVerdict verdict = validator.validate("2 + 3");
        assertTrue(verdict.isOk());
        assertEquals("Valid expression", verdict.getReason());
        assertTrue(validator.validate("SIN(x)").isOk());
        assertTrue(validator.validate("-3 + 2").isOk());
        assertTrue(validator.validate("2*(-3)").isOk());
    }
}
