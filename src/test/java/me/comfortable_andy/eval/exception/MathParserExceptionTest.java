package me.comfortable_andy.eval.exception;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MathParserExceptionTest {

    @Test
    public void testMessages() {
        assertEquals("Syntax error.", MathParserException.syntaxError().getMessage());
        assertEquals("Division by zero.", MathParserException.divisionByZero().getMessage());
        assertEquals("Zero raised to zero is undefined.", MathParserException.zeroToZero().getMessage());
        assertEquals("Unknown operator % encountered.", MathParserException.unknownOperator("%").getMessage());
        assertEquals("Unexpected operator || passed, expected &&", MathParserException.unexpectedOperator("||", "&&").getMessage());
        assertEquals("Unknown variable y encountered.", MathParserException.unknownVariable("y").getMessage());
    }

    @Test
    public void testReasonAndData() {
        final MathParserException mismatch = MathParserException.delimiterMismatch(")");
        assertEquals(MathParserException.Reason.DELIMITER_MISMATCH, mismatch.reason());
        assertEquals(")", mismatch.data());

        final MathParserException exponential = MathParserException.zeroToZero();
        assertEquals(MathParserException.Reason.EXPONENTIAL, exponential.reason());
        assertNull(exponential.data());

        assertEquals("foo", MathParserException.unknownFunction("foo").data());
        assertEquals(MathParserException.Reason.UNKNOWN_TOKEN, MathParserException.unknownToken("$").reason());
    }

    @Test
    public void testIsIllegalState() {
        // callers catching IllegalStateException keep working
        assertThrows(IllegalStateException.class, () -> {
            throw MathParserException.logarithmOfZero();
        });
    }

}
