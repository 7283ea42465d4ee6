package me.comfortable_andy.eval.exception;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * The single failure type of the engine. Every lexing, parsing, folding or evaluating problem
 * surfaces as one of these, tagged with a {@link Reason} and optionally the offending item.
 *
 * @author AndyNoob
 */
@Getter
@Accessors(fluent = true)
public class MathParserException extends IllegalStateException {

    private final Reason reason;
    private final /* nullable */ String data;

    public MathParserException(Reason reason, String message, String data) {
        super(message);
        this.reason = reason;
        this.data = data;
    }

    public MathParserException(Reason reason, String message) {
        this(reason, message, null);
    }

    public static MathParserException syntaxError() {
        return new MathParserException(Reason.SYNTAX_ERROR, "Syntax error.");
    }

    public static MathParserException delimiterMismatch(String delimiter) {
        return new MathParserException(Reason.DELIMITER_MISMATCH, "Unable to match delimiters.", delimiter);
    }

    public static MathParserException divisionByZero() {
        return new MathParserException(Reason.DIVISION_BY_ZERO, "Division by zero.");
    }

    public static MathParserException zeroToZero() {
        return new MathParserException(Reason.EXPONENTIAL, "Zero raised to zero is undefined.");
    }

    public static MathParserException logarithmOfZero() {
        return new MathParserException(Reason.LOGARITHM_OF_ZERO, "Logarithm of zero is undefined.");
    }

    public static MathParserException nullOperand() {
        return new MathParserException(Reason.NULL_OPERAND, "Null operand found.");
    }

    public static MathParserException unknownOperator(String operator) {
        return new MathParserException(Reason.UNKNOWN_OPERATOR, "Unknown operator " + operator + " encountered.", operator);
    }

    public static MathParserException unexpectedOperator(String passed, String expected) {
        return new MathParserException(Reason.UNEXPECTED_OPERATOR, "Unexpected operator " + passed + " passed, expected " + expected, passed);
    }

    public static MathParserException unknownToken(String token) {
        return new MathParserException(Reason.UNKNOWN_TOKEN, "Unknown token " + token + " encountered.", token);
    }

    public static MathParserException unknownFunction(String function) {
        return new MathParserException(Reason.UNKNOWN_FUNCTION, "Unknown function " + function + " encountered.", function);
    }

    public static MathParserException unknownConstant(String constant) {
        return new MathParserException(Reason.UNKNOWN_CONSTANT, "Unknown constant " + constant + " encountered.", constant);
    }

    public static MathParserException unknownVariable(String variable) {
        return new MathParserException(Reason.UNKNOWN_VARIABLE, "Unknown variable " + variable + " encountered.", variable);
    }

    public static MathParserException unexpectedValue(String message) {
        return new MathParserException(Reason.UNEXPECTED_VALUE, message);
    }

    public enum Reason {
        SYNTAX_ERROR,
        DELIMITER_MISMATCH,
        DIVISION_BY_ZERO,
        // zero raised to zero
        EXPONENTIAL,
        LOGARITHM_OF_ZERO,
        NULL_OPERAND,
        UNKNOWN_OPERATOR,
        UNEXPECTED_OPERATOR,
        UNKNOWN_TOKEN,
        UNKNOWN_FUNCTION,
        UNKNOWN_CONSTANT,
        UNKNOWN_VARIABLE,
        UNEXPECTED_VALUE
    }

}
